package com.qrorder.payment.handler;

import com.qrorder.payment.entity.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Input of a {@link PaymentMethodHandler}. {@code amount} is the rounded payable amount,
 * {@code expiresAt} is null for methods without a payment window.
 */
public record PaymentContext(
        String sessionCode,
        String transactionId,
        PaymentMethod method,
        BigDecimal amount,
        String merchantName,
        String customerEmail,
        String customerPhone,
        LocalDateTime expiresAt
) {
}
