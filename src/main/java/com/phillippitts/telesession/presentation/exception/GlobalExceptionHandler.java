package com.phillippitts.telesession.presentation.exception;

import com.phillippitts.telesession.exception.ConflictingOfferException;
import com.phillippitts.telesession.exception.InvalidTransitionException;
import com.phillippitts.telesession.exception.MalformedMessageException;
import com.phillippitts.telesession.exception.SessionClosedException;
import com.phillippitts.telesession.exception.SessionFullException;
import com.phillippitts.telesession.exception.SessionNotFoundException;
import com.phillippitts.telesession.exception.TeleSessionException;
import com.phillippitts.telesession.exception.UnknownParticipantException;
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
 * Converts session exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown or evicted session (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex) {
        LOG.info("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found");
    }

    /**
     * Session already ended (HTTP 410).
     */
    @ExceptionHandler(SessionClosedException.class)
    ResponseEntity<ApiError> handleClosed(SessionClosedException ex) {
        LOG.info("Session closed: {}", ex.getSessionId());
        return error(HttpStatus.GONE, ex, "Session has ended");
    }

    /**
     * Conflicts with the current session state (HTTP 409).
     */
    @ExceptionHandler({SessionFullException.class, ConflictingOfferException.class})
    ResponseEntity<ApiError> handleConflict(TeleSessionException ex) {
        LOG.warn("Session conflict: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Request conflicts with the session state");
    }

    /**
     * Client error - invalid input or illegal step (HTTP 400).
     */
    @ExceptionHandler({MalformedMessageException.class, InvalidTransitionException.class,
            UnknownParticipantException.class})
    ResponseEntity<ApiError> handleBadRequest(TeleSessionException ex) {
        LOG.warn("Rejected request: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid session request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid argument: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Request validation failed", details, Instant.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("MalformedRequest", "Request body is not valid JSON",
                    "Check the request body against the API contract", Instant.now()));
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

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, ex.getMessage(), Instant.now()));
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
