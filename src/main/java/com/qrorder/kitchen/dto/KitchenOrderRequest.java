package com.qrorder.kitchen.dto;

import java.util.List;

public record KitchenOrderRequest(
        Long outletId,
        Long tableId,
        String sessionCode,
        List<Line> lines
) {
    public record Line(
            Long productId,
            Long variantId,
            String productName,
            int quantity,
            String modifiers,
            String notes
    ) {}
}
