package com.streamrelay.streamrelay.exception;

public class MalformedWebhookException extends StreamRelayException {

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
