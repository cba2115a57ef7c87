package com.qrorder.payment.entity;

import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;

import java.util.Locale;

public enum PaymentMethod {
    CASH,
    QRIS,
    GOPAY,
    OVO,
    DANA,
    SHOPEEPAY;

    public boolean isEwallet() {
        return this == GOPAY || this == OVO || this == DANA || this == SHOPEEPAY;
    }

    /** Cash is settled at the counter and has no payment window. */
    public boolean hasPaymentWindow() {
        return this != CASH;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PaymentMethod from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.UNSUPPORTED_PAYMENT_METHOD, "Payment method is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNSUPPORTED_PAYMENT_METHOD,
                    "Unsupported payment method: " + value);
        }
    }
}
