package com.qrorder.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qrorder.payment.entity.PaymentReference;
import com.qrorder.session.entity.SelfOrderSession;
import com.qrorder.session.entity.SessionStatus;

import java.time.LocalDateTime;

public record PaymentStatusResponse(
        SessionStatus sessionStatus,
        @JsonProperty("isPaid") boolean paid,
        String paymentReference,
        String paymentMethod,
        String paymentStatus,
        LocalDateTime paymentCreatedAt,
        LocalDateTime paymentExpiresAt,
        LocalDateTime lastUpdated
) {
    /** {@code reference} may be null when no payment was started yet. */
    public static PaymentStatusResponse of(SelfOrderSession session, PaymentReference reference) {
        return new PaymentStatusResponse(
                session.getStatus(),
                session.isPaid(),
                reference != null ? reference.getTransactionId() : null,
                reference != null ? reference.getMethod().code() : null,
                reference != null ? reference.getStatus().name().toLowerCase() : null,
                reference != null ? reference.getCreatedAt() : null,
                reference != null ? reference.getExpiresAt() : null,
                session.getUpdatedAt());
    }
}
