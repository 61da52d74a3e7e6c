package com.streamrelay.streamrelay.config.exception;

import com.streamrelay.streamrelay.exception.MalformedWebhookException;
import com.streamrelay.streamrelay.exception.PlatformApiException;
import com.streamrelay.streamrelay.exception.RecordingNotFoundException;
import com.streamrelay.streamrelay.exception.StreamKeyRejectedException;
import com.streamrelay.streamrelay.exception.WebhookVerificationException;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Converts domain exceptions raised by the controllers into JSON error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Admission refused. The media server treats any non-2xx answer as "reject the publish".
     */
    @ExceptionHandler(StreamKeyRejectedException.class)
    public ResponseEntity<ApiError> handleRejectedStreamKey(StreamKeyRejectedException ex) {
        log.warn("Publish rejected: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, ex, "Publish rejected");
    }

    @ExceptionHandler(RecordingNotFoundException.class)
    public ResponseEntity<ApiError> handleRecordingNotFound(RecordingNotFoundException ex) {
        log.debug("Recording not found: {}", ex.getIdentifier());
        return error(HttpStatus.NOT_FOUND, ex, ex.getMessage());
    }

    @ExceptionHandler(WebhookVerificationException.class)
    public ResponseEntity<ApiError> handleWebhookVerification(WebhookVerificationException ex) {
        log.warn("Webhook signature rejected: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, ex, "Invalid webhook signature");
    }

    @ExceptionHandler(MalformedWebhookException.class)
    public ResponseEntity<ApiError> handleMalformedWebhook(MalformedWebhookException ex) {
        log.warn("Malformed webhook payload: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Malformed webhook payload");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, ex.getMessage());
    }

    @ExceptionHandler(PlatformApiException.class)
    public ResponseEntity<ApiError> handlePlatformApi(PlatformApiException ex) {
        log.error("Platform API call failed: operation={}", ex.getOperation(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Media platform unavailable");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("InternalServerError", "An unexpected error occurred", Instant.now()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message) {
        return ResponseEntity
                .status(status)
                .body(new ApiError(ex.getClass().getSimpleName(), message, Instant.now()));
    }

    /**
     * Error body returned to API clients.
     */
    @Value
    public static class ApiError {
        String errorCode;
        String message;
        Instant timestamp;
    }
}
