package com.qrorder.common.exception;

import com.qrorder.common.filter.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Renders errors as RFC 7807 {@link ProblemDetail}.
 *
 * <p>Besides {@code type}/{@code status}/{@code detail}, every problem carries
 * the {@code code} (an {@link ErrorCode} name) and the request's {@code correlationId}.</p>
 *
 * <pre>
 *   {
 *     "type": "https://qrorder.dev/errors/amount_mismatch",
 *     "status": 400,
 *     "detail": "Payment amount does not match order total",
 *     "code": "AMOUNT_MISMATCH",
 *     "correlationId": "5f0c..."
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        log.info("Request rejected: code={}, detail={}", e.getErrorCode(), e.getMessage());
        return problem(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return problem(ErrorCode.INVALID_INPUT, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException e) {
        return problem(ErrorCode.INVALID_INPUT, "Malformed request body");
    }

    // two requests raced on a unique key, e.g. the first payment attempt of a session
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Concurrent write rejected: {}", e.getMostSpecificCause().getMessage());
        return problem(ErrorCode.STATUS_CONFLICT, "Concurrent update, please retry");
    }

    // Storage unavailability is not retried here, the caller decides
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException e) {
        log.error("Storage failure", e);
        return problem(ErrorCode.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // framework errors (404 route, 405 method, missing parameter) keep their status
            ProblemDetail body = errorResponse.getBody();
            body.setProperty("correlationId", CorrelationIdFilter.currentId());
            return ResponseEntity.status(errorResponse.getStatusCode()).body(body);
        }
        log.error("Unexpected error", e);
        return problem(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create("https://qrorder.dev/errors/" + errorCode.name().toLowerCase()));
        problem.setProperty("code", errorCode.name());
        problem.setProperty("correlationId", CorrelationIdFilter.currentId());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }
}
