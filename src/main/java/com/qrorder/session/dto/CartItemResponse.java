package com.qrorder.session.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;

public record CartItemResponse(
        Long id,
        Long productId,
        Long variantId,
        String productName,
        int quantity,
        JsonNode modifiers,
        String notes,
        LocalDateTime createdAt
) {}
