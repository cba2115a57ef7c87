package com.qrorder.session.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;
import com.qrorder.session.dto.CartItemResponse;
import com.qrorder.session.entity.CartItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts the free-form modifier payload between its JSON text column and the API.
 */
@Component
@RequiredArgsConstructor
public class CartItemMapper {

    private static final String EMPTY_MODIFIERS = "[]";

    private final ObjectMapper objectMapper;

    public String writeModifiers(JsonNode modifiers) {
        if (modifiers == null || modifiers.isNull()) {
            return EMPTY_MODIFIERS;
        }
        try {
            return objectMapper.writeValueAsString(modifiers);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "modifiers is not valid JSON");
        }
    }

    public JsonNode readModifiers(String modifiers) {
        try {
            return objectMapper.readTree(modifiers);
        } catch (JsonProcessingException e) {
            // column is only written by writeModifiers, a parse failure means a corrupt row
            throw new IllegalStateException("Stored modifiers are not valid JSON", e);
        }
    }

    public CartItemResponse toResponse(CartItem item) {
        return new CartItemResponse(
                item.getId(),
                item.getProductId(),
                item.getVariantId(),
                item.getProductName(),
                item.getQuantity(),
                readModifiers(item.getModifiers()),
                item.getNotes(),
                item.getCreatedAt());
    }
}
