package com.qrorder.payment.dto;

import com.qrorder.payment.service.SessionTotal;

import java.math.BigDecimal;

public record SessionTotalResponse(
        BigDecimal subtotal,
        BigDecimal taxAmount,
        BigDecimal serviceChargeAmount,
        BigDecimal grandTotal,
        BigDecimal payableAmount,
        int itemCount
) {
    public static SessionTotalResponse from(SessionTotal total) {
        return new SessionTotalResponse(
                total.subtotal(),
                total.taxAmount(),
                total.serviceChargeAmount(),
                total.grandTotal(),
                total.payableAmount(),
                total.itemCount());
    }
}
