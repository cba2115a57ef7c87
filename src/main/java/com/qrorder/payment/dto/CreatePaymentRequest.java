package com.qrorder.payment.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreatePaymentRequest(
        @NotBlank String paymentMethod,
        @NotNull @Positive BigDecimal amount,
        @Email String customerEmail,
        @Size(max = 30) String customerPhone
) {
}
