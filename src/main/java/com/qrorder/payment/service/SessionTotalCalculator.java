package com.qrorder.payment.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * grandTotal = subtotal × (1 + tax% / 100 + service% / 100), without intermediate rounding.
 */
@Component
public class SessionTotalCalculator {

    public record PricedLine(BigDecimal unitPrice, int quantity) {
    }

    public SessionTotal calculate(List<PricedLine> lines, BigDecimal taxRate, BigDecimal serviceChargeRate) {
        BigDecimal subtotal = BigDecimal.ZERO;
        int itemCount = 0;
        for (PricedLine line : lines) {
            subtotal = subtotal.add(line.unitPrice().multiply(BigDecimal.valueOf(line.quantity())));
            itemCount += line.quantity();
        }

        BigDecimal taxAmount = percentOf(subtotal, taxRate);
        BigDecimal serviceChargeAmount = percentOf(subtotal, serviceChargeRate);
        BigDecimal grandTotal = subtotal.add(taxAmount).add(serviceChargeAmount);

        return new SessionTotal(subtotal, taxAmount, serviceChargeAmount, grandTotal, itemCount);
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal rate) {
        if (rate == null) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(rate).movePointLeft(2);
    }
}
