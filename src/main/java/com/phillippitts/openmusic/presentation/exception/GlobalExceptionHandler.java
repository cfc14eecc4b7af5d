package com.phillippitts.openmusic.presentation.exception;

import com.phillippitts.openmusic.exception.AllBackendsFailedException;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.NoResultsException;
import com.phillippitts.openmusic.exception.QuarantinedItemException;
import com.phillippitts.openmusic.exception.QueueFullException;
import com.phillippitts.openmusic.util.LogSanitizer;
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
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Every backend failed with an error - transient, retry possible (HTTP 503).
     */
    @ExceptionHandler(AllBackendsFailedException.class)
    ResponseEntity<ApiError> handleAllBackendsFailed(AllBackendsFailedException ex) {
        LOG.warn("All backends failed: attempted={}, last={}", ex.getAttemptedBackends(),
                ex.getLastError().getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex,
                "Media sources temporarily unavailable",
                "Tried: " + String.join(", ", ex.getAttemptedBackends()) + ". Please retry later.");
    }

    /**
     * Nothing found (HTTP 404).
     */
    @ExceptionHandler(NoResultsException.class)
    ResponseEntity<ApiError> handleNoResults(NoResultsException ex) {
        LOG.info("No results: query='{}', attempted={}", LogSanitizer.query(ex.getQuery()),
                ex.getAttemptedBackends());
        String tried = ex.getAttemptedBackends().isEmpty()
                ? "No backend is enabled"
                : "Tried: " + String.join(", ", ex.getAttemptedBackends());
        return error(HttpStatus.NOT_FOUND, ex, "No results found", tried);
    }

    /**
     * Queue at capacity (HTTP 409).
     */
    @ExceptionHandler(QueueFullException.class)
    ResponseEntity<ApiError> handleQueueFull(QueueFullException ex) {
        LOG.info("Queue full: max={}", ex.getMaxSize());
        return error(HttpStatus.CONFLICT, ex, "Queue is full", ex.getMessage());
    }

    /**
     * Item keeps failing and is cooling down (HTTP 422).
     */
    @ExceptionHandler(QuarantinedItemException.class)
    ResponseEntity<ApiError> handleQuarantined(QuarantinedItemException ex) {
        LOG.info("Rejected quarantined item: {} ({} failures)", LogSanitizer.redactUrl(ex.getUrl()),
                ex.getFailureCount());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, "Item failed too often",
                "Try again after the recovery cooldown");
    }

    /**
     * Transient backend error escaping a single-backend call (HTTP 503).
     */
    @ExceptionHandler(BackendException.class)
    ResponseEntity<ApiError> handleBackend(BackendException ex) {
        LOG.error("Backend failure: backend={}, kind={}", ex.getBackendName(), ex.getKind(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Media source temporarily unavailable",
                "Please retry in a few seconds");
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request body: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
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
