package com.phillippitts.streamwatch.presentation.exception;

import com.phillippitts.streamwatch.exception.ChannelNotFoundException;
import com.phillippitts.streamwatch.exception.InvalidChannelPatchException;
import com.phillippitts.streamwatch.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown channel id (HTTP 404).
     */
    @ExceptionHandler(ChannelNotFoundException.class)
    ResponseEntity<ApiError> handleChannelNotFound(ChannelNotFoundException ex) {
        LOG.warn("Channel not found: {}", ex.getChannelId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Channel not found", ex.getMessage());
    }

    /**
     * Client error - patch names an unknown field or carries a bad value (HTTP 400).
     */
    @ExceptionHandler(InvalidChannelPatchException.class)
    ResponseEntity<ApiError> handleInvalidPatch(InvalidChannelPatchException ex) {
        LOG.warn("Rejected channel patch: field={}", ex.getField());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid channel configuration",
                ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body");
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Invalid request", "Request body is not valid JSON");
    }

    /**
     * Channel store unavailable - in-memory state is intact, retry possible (HTTP 503).
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        LOG.error("Channel store failure: path={}", ex.getPath(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Channel store temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
