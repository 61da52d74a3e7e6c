package com.streamrelay.streamrelay.util;

import java.util.Optional;

/**
 * Derives stream keys from publish paths such as {@code /live/abc123}.
 */
public final class StreamKeys {

    private StreamKeys() {
        // utility
    }

    /**
     * @return the final path segment, or empty when the path is absent or ends with '/'
     */
    public static Optional<String> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String p = path;
        int query = p.indexOf('?');
        if (query >= 0) {
            p = p.substring(0, query);
        }
        String key = p.substring(p.lastIndexOf('/') + 1).trim();
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }

    /** True when the key can be used as a single file-name component. */
    public static boolean isSafeComponent(String value) {
        return value != null
                && !value.isBlank()
                && !value.contains("/")
                && !value.contains("\\")
                && !value.contains("..");
    }
}
