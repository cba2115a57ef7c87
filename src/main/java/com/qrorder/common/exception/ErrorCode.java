package com.qrorder.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by the self-order endpoints.
 *
 * <p>The enum name is the stable machine-readable code returned to clients,
 * the status decides the HTTP response class.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Catalog
    OUTLET_NOT_FOUND(HttpStatus.NOT_FOUND, "Outlet not found"),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "Product not found"),
    VARIANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Variant not found"),
    PRODUCT_UNAVAILABLE(HttpStatus.BAD_REQUEST, "Product is not available"),

    // Session
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found"),
    SESSION_EXPIRED(HttpStatus.GONE, "Session has expired"),
    INVALID_SESSION_STATUS(HttpStatus.BAD_REQUEST, "Invalid session status for this operation"),
    EMPTY_CART(HttpStatus.BAD_REQUEST, "Cannot submit empty order"),
    STATUS_CONFLICT(HttpStatus.CONFLICT, "Session status was changed concurrently"),

    // Payment
    AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST, "Payment amount does not match order total"),
    UNSUPPORTED_PAYMENT_METHOD(HttpStatus.BAD_REQUEST, "Unsupported payment method"),
    // never rendered, callbacks with unparseable ids are absorbed
    MALFORMED_CALLBACK(HttpStatus.BAD_REQUEST, "Malformed payment callback");

    private final HttpStatus status;
    private final String message;
}
