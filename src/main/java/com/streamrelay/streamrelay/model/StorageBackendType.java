package com.streamrelay.streamrelay.model;

import java.util.Locale;
import java.util.Optional;

public enum StorageBackendType {
    LOCAL,
    REMOTE;

    /**
     * Resolves a configured backend name. {@code gcs} is accepted as an alias of {@code remote}.
     *
     * @return the backend type, or empty when the value is absent or not recognized
     */
    public static Optional<StorageBackendType> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local":
                return Optional.of(LOCAL);
            case "remote":
            case "gcs":
                return Optional.of(REMOTE);
            default:
                return Optional.empty();
        }
    }
}
