package com.streamrelay.streamrelay.exception;

/**
 * A call to the real-time media platform API failed (transport error or non-2xx response).
 */
public class PlatformApiException extends StreamRelayException {

    private final String operation;

    public PlatformApiException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
