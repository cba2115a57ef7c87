package com.qrorder.kitchen.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Kitchen display side of {@link OrderStatusChangedEvent}. Only committed
 * orders are announced, a rolled back handoff never reaches the kitchen.
 */
@Slf4j
@Component
public class KitchenTicketListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        log.info("Kitchen ticket update: orderId={}, outletId={}, '{}' -> '{}'",
                event.orderId(), event.outletId(), event.previousStatus(), event.newStatus());
    }
}
