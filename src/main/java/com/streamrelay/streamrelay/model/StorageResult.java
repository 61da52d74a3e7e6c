package com.streamrelay.streamrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a save. Expected failures are reported here with {@code success=false} rather than
 * thrown; {@code metadata} is always populated.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StorageResult {
    boolean success;
    String filePath;
    String url;
    @NonNull
    StorageMetadata metadata;
    String error;

    public static StorageResult failure(String streamKey, String error) {
        return StorageResult.builder()
                .success(false)
                .metadata(StorageMetadata.empty(streamKey))
                .error(error)
                .build();
    }
}
