package com.qrorder.catalog.service;

import com.qrorder.catalog.dto.OutletInfo;
import com.qrorder.catalog.dto.ProductInfo;
import com.qrorder.catalog.entity.Outlet;
import com.qrorder.catalog.entity.Product;
import com.qrorder.catalog.repository.OutletRepository;
import com.qrorder.catalog.repository.ProductRepository;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * 카탈로그 조회 (JPA 구현)
 *
 * <p>결과는 Caffeine에 캐시된다. 가격 변경은 캐시 항목이 만료된 뒤 반영된다
 * ({@code spring.cache.caffeine.spec} 참고).</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogService implements CatalogClient {

    private final OutletRepository outletRepository;
    private final ProductRepository productRepository;

    @Override
    @Cacheable(value = "outlets", key = "#outletId")
    public OutletInfo getOutlet(Long outletId) {
        Outlet outlet = outletRepository.findById(outletId)
                .orElseThrow(() -> new BusinessException(ErrorCode.OUTLET_NOT_FOUND));
        return new OutletInfo(outlet.getId(), outlet.getName(),
                outlet.getTaxRate(), outlet.getServiceChargeRate());
    }

    @Override
    @Cacheable(value = "products", key = "#productId")
    public ProductInfo getProduct(Long productId) {
        Product product = productRepository.findWithVariantsById(productId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));
        return new ProductInfo(
                product.getId(),
                product.getOutlet().getId(),
                product.getName(),
                product.getBasePrice(),
                product.isAvailable(),
                product.getVariants().stream()
                        .map(v -> new ProductInfo.VariantInfo(v.getId(), v.getName(), v.getPrice(), v.isAvailable()))
                        .toList());
    }

    @Override
    public BigDecimal resolveUnitPrice(Long productId, Long variantId) {
        // self-invocation, not served from the cache
        ProductInfo product = getProduct(productId);
        if (variantId == null) {
            return product.basePrice();
        }
        return product.findVariant(variantId)
                .map(ProductInfo.VariantInfo::price)
                .orElseThrow(() -> new BusinessException(ErrorCode.VARIANT_NOT_FOUND));
    }
}
