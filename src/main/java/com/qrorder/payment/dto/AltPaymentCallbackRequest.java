package com.qrorder.payment.dto;

/**
 * Body of the second webhook path. {@code paymentId} carries the transaction id;
 * {@code sessionCode} is informational, the session is resolved from the transaction id.
 */
public record AltPaymentCallbackRequest(
        String sessionCode,
        String paymentId,
        String status
) {
}
