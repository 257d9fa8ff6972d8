package com.phillippitts.cabinassist.presentation.exception;

import com.phillippitts.cabinassist.exception.CommandExecutionException;
import com.phillippitts.cabinassist.exception.ComponentFailureException;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;
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
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed context update or command (HTTP 400).
     */
    @ExceptionHandler({SchemaMismatchException.class, CommandExecutionException.class})
    ResponseEntity<ApiError> handleInvalidInput(RuntimeException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    /**
     * Client error - bean validation failed on the request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "MalformedBody", "Invalid request", "Request body could not be parsed");
    }

    /**
     * Assistant not in a state to accept input (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleNotActive(IllegalStateException ex) {
        LOG.info("Request refused: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "AssistantUnavailable", ex.getMessage(), "Retry once the assistant is active");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(ComponentFailureException.class)
    ResponseEntity<ApiError> handleComponentFailure(ComponentFailureException ex) {
        LOG.error("Component failure: component={}", ex.getComponentName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Assistant component temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
