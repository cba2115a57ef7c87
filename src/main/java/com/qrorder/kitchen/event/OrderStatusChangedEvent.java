package com.qrorder.kitchen.event;

/**
 * Lifecycle event of a kitchen order. A new ticket is announced with an empty
 * {@code previousStatus} and {@code newStatus = "pending"}.
 */
public record OrderStatusChangedEvent(
        Long orderId,
        Long outletId,
        String previousStatus,
        String newStatus
) {
    public static OrderStatusChangedEvent created(Long orderId, Long outletId) {
        return new OrderStatusChangedEvent(orderId, outletId, "", "pending");
    }
}
