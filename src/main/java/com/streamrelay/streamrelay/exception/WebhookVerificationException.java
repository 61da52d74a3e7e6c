package com.streamrelay.streamrelay.exception;

public class WebhookVerificationException extends StreamRelayException {

    public WebhookVerificationException(String message) {
        super(message);
    }

    public WebhookVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
