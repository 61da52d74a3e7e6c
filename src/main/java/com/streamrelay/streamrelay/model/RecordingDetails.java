package com.streamrelay.streamrelay.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied, optional part of a recording's metadata. Any field may be null.
 */
@Value
@Builder
public class RecordingDetails {

    public static final RecordingDetails NONE = RecordingDetails.builder().build();

    Double duration;
    String quality;
    String thumbnailPath;

    /** Non-null fields coerced to strings, as attached to remote objects. */
    public Map<String, String> asAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (duration != null) {
            attributes.put("duration", String.valueOf(duration));
        }
        if (quality != null) {
            attributes.put("quality", quality);
        }
        if (thumbnailPath != null) {
            attributes.put("thumbnailPath", thumbnailPath);
        }
        return attributes;
    }

    /** Merges these details over {@code base}, keeping base values where a field here is null. */
    public StorageMetadata applyTo(StorageMetadata base) {
        StorageMetadata.StorageMetadataBuilder builder = base.toBuilder();
        if (duration != null) {
            builder.duration(duration);
        }
        if (quality != null) {
            builder.quality(quality);
        }
        if (thumbnailPath != null) {
            builder.thumbnailPath(thumbnailPath);
        }
        return builder.build();
    }
}
