package com.streamrelay.streamrelay.exception;

/**
 * Publish admission refused because no usable stream key could be derived.
 */
public class StreamKeyRejectedException extends StreamRelayException {

    private final String path;

    public StreamKeyRejectedException(String path) {
        super("Invalid stream key for path: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
