package com.qrorder.payment.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Unrounded totals of a session. {@link #payableAmount()} is the only rounded value.
 */
public record SessionTotal(
        BigDecimal subtotal,
        BigDecimal taxAmount,
        BigDecimal serviceChargeAmount,
        BigDecimal grandTotal,
        int itemCount
) {
    /** Grand total rounded half-up to whole currency units. */
    public BigDecimal payableAmount() {
        return grandTotal.setScale(0, RoundingMode.HALF_UP);
    }

    public boolean matches(BigDecimal tenderedAmount, BigDecimal tolerance) {
        return payableAmount().subtract(tenderedAmount).abs().compareTo(tolerance) <= 0;
    }
}
