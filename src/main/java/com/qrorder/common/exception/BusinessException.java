package com.qrorder.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for domain rule violations.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.SESSION_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.STATUS_CONFLICT, "Session is PAID");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
