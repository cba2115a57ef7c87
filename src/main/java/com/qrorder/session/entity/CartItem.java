package com.qrorder.session.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "self_order_items", indexes = {
        @Index(name = "idx_self_order_items_session", columnList = "sessionId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class CartItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "self_order_item_seq")
    @SequenceGenerator(name = "self_order_item_seq", sequenceName = "self_order_item_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long sessionId;

    @Column(nullable = false)
    private Long productId;

    private Long variantId;

    /** Catalog name at the time the item was added, the kitchen ticket prints it. */
    @Column(nullable = false)
    private String productName;

    @Column(nullable = false)
    private int quantity;

    /** Free-form modifier selection as JSON, {@code []} when none. */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String modifiers;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public CartItem(Long sessionId, Long productId, Long variantId, String productName, int quantity,
                    String modifiers, String notes) {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be at least 1");
        }
        this.sessionId = sessionId;
        this.productId = productId;
        this.variantId = variantId;
        this.productName = productName;
        this.quantity = quantity;
        this.modifiers = modifiers == null ? "[]" : modifiers;
        this.notes = notes;
    }
}
