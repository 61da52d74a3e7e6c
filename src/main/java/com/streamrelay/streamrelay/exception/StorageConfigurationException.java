package com.streamrelay.streamrelay.exception;

/**
 * Storage backend could not be brought up. Fatal: the application must not serve with a
 * half-configured backend.
 */
public class StorageConfigurationException extends StreamRelayException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
