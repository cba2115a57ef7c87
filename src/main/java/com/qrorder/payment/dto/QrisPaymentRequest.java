package com.qrorder.payment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record QrisPaymentRequest(
        @NotNull(message = "Amount must be greater than 0") @Positive(message = "Amount must be greater than 0") BigDecimal amount
) {
}
