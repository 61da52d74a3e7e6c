package com.streamrelay.streamrelay.exception;

/**
 * Base exception for application-specific errors.
 * Subclasses map to HTTP status codes in the global exception handler.
 */
public class StreamRelayException extends RuntimeException {

    public StreamRelayException(String message) {
        super(message);
    }

    public StreamRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
