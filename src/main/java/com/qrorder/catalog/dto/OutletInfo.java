package com.qrorder.catalog.dto;

import java.math.BigDecimal;

/**
 * Outlet configuration needed to price a cart. Rates are percentages.
 */
public record OutletInfo(
        Long id,
        String name,
        BigDecimal taxRate,
        BigDecimal serviceChargeRate
) {
}
