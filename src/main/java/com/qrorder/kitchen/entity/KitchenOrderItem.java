package com.qrorder.kitchen.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "kitchen_order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class KitchenOrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Setter(AccessLevel.PACKAGE)
    private KitchenOrder order;

    @Column(nullable = false)
    private Long productId;

    private Long variantId;

    @Column(nullable = false)
    private String productName;

    @Column(nullable = false)
    private int quantity;

    @Column(columnDefinition = "TEXT")
    private String modifiers;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private KitchenOrderStatus status;

    @Builder
    public KitchenOrderItem(Long productId, Long variantId, String productName,
                            int quantity, String modifiers, String notes) {
        this.productId = productId;
        this.variantId = variantId;
        this.productName = productName;
        this.quantity = quantity;
        this.modifiers = modifiers;
        this.notes = notes;
        this.status = KitchenOrderStatus.PENDING;
    }
}
