package com.qrorder.session.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param modifiers any JSON value chosen by the menu UI (usually an array of modifier selections)
 */
public record AddItemRequest(
        @NotNull(message = "productId is required")
        Long productId,

        Long variantId,

        @NotNull(message = "quantity is required")
        @Min(value = 1, message = "quantity must be at least 1")
        Integer quantity,

        JsonNode modifiers,

        @Size(max = 500, message = "notes must be at most 500 characters")
        String notes
) {}
