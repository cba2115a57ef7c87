package com.qrorder.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * What the customer needs to complete a payment attempt: a counter instruction,
 * a QR code or a redirect URL depending on the method.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentResult(
        boolean success,
        String transactionId,
        String paymentMethod,
        String paymentUrl,
        String qrCode,
        String qrCodeData,
        LocalDateTime expiresAt,
        String message
) {
}
