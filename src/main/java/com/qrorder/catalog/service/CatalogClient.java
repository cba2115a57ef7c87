package com.qrorder.catalog.service;

import com.qrorder.catalog.dto.OutletInfo;
import com.qrorder.catalog.dto.ProductInfo;

import java.math.BigDecimal;

/**
 * Read-only view of the menu catalog and outlet configuration.
 *
 * <p>Lookups may block on storage or a remote catalog, callers must not hold
 * a session lock while invoking them.</p>
 */
public interface CatalogClient {

    /**
     * @throws com.qrorder.common.exception.BusinessException {@code OUTLET_NOT_FOUND}
     */
    OutletInfo getOutlet(Long outletId);

    /**
     * @throws com.qrorder.common.exception.BusinessException {@code PRODUCT_NOT_FOUND}
     */
    ProductInfo getProduct(Long productId);

    /**
     * Variant price when a variant is given, otherwise the product's base price.
     *
     * @throws com.qrorder.common.exception.BusinessException {@code PRODUCT_NOT_FOUND}
     *         or {@code VARIANT_NOT_FOUND}
     */
    BigDecimal resolveUnitPrice(Long productId, Long variantId);
}
