package com.streamrelay.streamrelay.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Naming scheme shared by the storage backends:
 * {@code <streamKey>_<yyyy-MM-dd'T'HH-mm-ss-SSS'Z'>.<ext>}.
 * The timestamp is the ISO-8601 UTC instant with ':' and '.' replaced by '-'.
 */
public final class RecordingFileNames {

    public static final char SEPARATOR = '_';

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private RecordingFileNames() {
        // utility
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    public static String fileName(String streamKey, Instant instant, String extension) {
        return streamKey + SEPARATOR + timestamp(instant) + "." + extension;
    }

    /**
     * Recovers the stream key by splitting at the first separator. Ambiguous for stream keys that
     * themselves contain the separator: {@code a_b_<ts>.flv} yields {@code a}.
     */
    public static String streamKeyOf(String fileName) {
        int idx = fileName.indexOf(SEPARATOR);
        return idx < 0 ? fileName : fileName.substring(0, idx);
    }

    public static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
