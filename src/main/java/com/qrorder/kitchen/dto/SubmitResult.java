package com.qrorder.kitchen.dto;

/**
 * @param alreadySubmitted true when another request had already submitted the
 *                         session and this one only received the existing order
 */
public record SubmitResult(
        String sessionCode,
        Long orderId,
        String orderNumber,
        boolean alreadySubmitted
) {}
