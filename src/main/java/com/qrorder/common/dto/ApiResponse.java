package com.qrorder.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope used by every self-order endpoint except the payment webhook.
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
