package com.phillippitts.coordination.presentation.exception;

import com.phillippitts.coordination.exception.AdmissionRejectedException;
import com.phillippitts.coordination.exception.CoordinationException;
import com.phillippitts.coordination.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts coordination exceptions to HTTP responses with status codes chosen by error kind.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Admission rejection: BUSY → 409, capacity or budget → 422, invalid count → 400.
     */
    @ExceptionHandler(AdmissionRejectedException.class)
    ResponseEntity<ApiError> handleRejected(AdmissionRejectedException ex) {
        LOG.info("Coordination rejected: kind={}, cost={}", ex.getKind(), ex.getDecision().estimatedCost());
        return ResponseEntity
            .status(statusFor(ex))
            .body(new ApiError(
                ex.getKind().name(),
                "Coordination request rejected",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Other engine errors, mapped by kind.
     */
    @ExceptionHandler(CoordinationException.class)
    ResponseEntity<ApiError> handleCoordination(CoordinationException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            LOG.error("Coordination failure: kind={}", ex.getKind(), ex);
        } else {
            LOG.warn("Invalid coordination request: kind={}, reason={}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getKind().name(),
                status.is5xxServerError() ? "Coordination engine error" : "Invalid coordination request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - bean validation failed (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("INVALID_REQUEST", "Request validation failed", details, Instant.now()));
    }

    /**
     * Client error - malformed JSON or unknown enum value (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("INVALID_REQUEST", "Malformed request body",
                "Check field names and enum values", Instant.now()));
    }

    /**
     * Client error - query parameter missing or not convertible (HTTP 400).
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadParameter(Exception ex) {
        String details;
        if (ex instanceof MissingServletRequestParameterException missing) {
            details = "Missing parameter: " + missing.getParameterName();
        } else {
            MethodArgumentTypeMismatchException mismatch = (MethodArgumentTypeMismatchException) ex;
            details = "Invalid value for parameter " + mismatch.getName() + ": "
                + LogSanitizer.singleLine(String.valueOf(mismatch.getValue()), 100);
        }
        LOG.warn("Bad request parameter: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("INVALID_REQUEST", "Invalid request parameter", details, Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(CoordinationException ex) {
        return switch (ex.getKind()) {
            case BUSY -> HttpStatus.CONFLICT;
            case OVER_CAPACITY, BUDGET_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_COUNT, INVALID_REQUEST, ORPHAN_COMPLETION -> HttpStatus.BAD_REQUEST;
            case PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
