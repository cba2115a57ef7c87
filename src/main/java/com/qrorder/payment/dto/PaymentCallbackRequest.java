package com.qrorder.payment.dto;

/**
 * Gateway webhook body. Not validated: every callback is acknowledged and bad
 * ones are only logged.
 */
public record PaymentCallbackRequest(
        String orderId,
        String status
) {
}
