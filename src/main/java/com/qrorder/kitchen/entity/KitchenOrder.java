package com.qrorder.kitchen.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Kitchen-facing ticket created from a finalized self-order cart.
 *
 * <p>{@code sourceSessionCode} is unique: a self-order session can never back
 * more than one kitchen order, whichever path created it.</p>
 */
@Entity
@Table(name = "kitchen_orders", indexes = {
        @Index(name = "idx_kitchen_order_outlet_created", columnList = "outletId, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class KitchenOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 30)
    private String orderNumber;

    @Column(nullable = false)
    private Long outletId;

    private Long tableId;

    @Column(unique = true, length = 50)
    private String sourceSessionCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private KitchenOrderStatus status;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<KitchenOrderItem> items = new ArrayList<>();

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public KitchenOrder(String orderNumber, Long outletId, Long tableId,
                        String sourceSessionCode, OrderType orderType) {
        this.orderNumber = orderNumber;
        this.outletId = outletId;
        this.tableId = tableId;
        this.sourceSessionCode = sourceSessionCode;
        this.orderType = orderType;
        this.status = KitchenOrderStatus.PENDING;
    }

    public void addItem(KitchenOrderItem item) {
        items.add(item);
        item.setOrder(this);
    }
}
