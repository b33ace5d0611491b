package com.phillippitts.streamwatch.presentation.exception;

import com.phillippitts.streamwatch.exception.ControlTimeoutException;
import com.phillippitts.streamwatch.exception.EngineUnavailableException;
import com.phillippitts.streamwatch.exception.InvalidEndpointException;
import com.phillippitts.streamwatch.exception.SessionStartException;
import com.phillippitts.streamwatch.exception.StreamWatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
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
     * Client error - unusable stream endpoint (HTTP 400). The endpoint itself is never echoed.
     */
    @ExceptionHandler(InvalidEndpointException.class)
    ResponseEntity<ApiError> handleInvalidEndpoint(InvalidEndpointException ex) {
        LOG.warn("Invalid endpoint rejected: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid stream endpoint",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationFailed",
                "Request validation failed",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - malformed JSON or settings rejected by the domain (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Request could not be processed",
                ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request body",
                Instant.now()
            ));
    }

    /**
     * Engine missing or failed to start (HTTP 503).
     */
    @ExceptionHandler({EngineUnavailableException.class, SessionStartException.class})
    ResponseEntity<ApiError> handleEngineFailure(StreamWatchException ex) {
        LOG.error("Stream engine unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Streaming engine unavailable",
                "Check the capture device and encoder installation",
                Instant.now()
            ));
    }

    /**
     * Transient error - control loop busy (HTTP 503).
     */
    @ExceptionHandler(ControlTimeoutException.class)
    ResponseEntity<ApiError> handleControlTimeout(ControlTimeoutException ex) {
        LOG.error("Control loop did not respond: operation={}", ex.getOperation());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Stream control temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
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

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
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
