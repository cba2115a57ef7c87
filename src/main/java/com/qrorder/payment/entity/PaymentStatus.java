package com.qrorder.payment.entity;

import java.util.Locale;
import java.util.Optional;

public enum PaymentStatus {
    PENDING,
    SUCCESS,
    FAILED;

    /**
     * Maps the status string of a gateway callback. Gateways are not consistent
     * about {@code failed} vs {@code failure}, both are accepted.
     */
    public static Optional<PaymentStatus> fromCallback(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "success" -> Optional.of(SUCCESS);
            case "failed", "failure" -> Optional.of(FAILED);
            case "pending" -> Optional.of(PENDING);
            default -> Optional.empty();
        };
    }
}
