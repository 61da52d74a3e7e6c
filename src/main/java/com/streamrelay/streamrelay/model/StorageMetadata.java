package com.streamrelay.streamrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Describes one persisted recording. Together with the backend-specific location it identifies the
 * recording uniquely.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StorageMetadata {
    String streamKey;
    String fileName;
    long fileSize;
    /** Seconds. */
    Double duration;
    String quality;
    String thumbnailPath;
    Instant uploadTime;

    /** Zeroed metadata reported alongside a failed storage operation. */
    public static StorageMetadata empty(String streamKey) {
        return StorageMetadata.builder()
                .streamKey(streamKey)
                .fileName("")
                .fileSize(0L)
                .uploadTime(Instant.now())
                .build();
    }
}
