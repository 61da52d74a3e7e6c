package com.streamrelay.streamrelay.exception;

public class RecordingNotFoundException extends StreamRelayException {

    private final String identifier;

    public RecordingNotFoundException(String identifier) {
        super("RecordingNotFound: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
