package com.qrorder.catalog.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record ProductInfo(
        Long id,
        Long outletId,
        String name,
        BigDecimal basePrice,
        boolean available,
        List<VariantInfo> variants
) {
    public Optional<VariantInfo> findVariant(Long variantId) {
        return variants.stream()
                .filter(variant -> variant.id().equals(variantId))
                .findFirst();
    }

    public record VariantInfo(Long id, String name, BigDecimal price, boolean available) {
    }
}
