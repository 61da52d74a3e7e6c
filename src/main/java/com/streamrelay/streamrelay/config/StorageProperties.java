package com.streamrelay.streamrelay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for recording storage.
 * The {@code backend} value is kept as a raw string so that unknown values can fall back to local
 * storage with a warning instead of failing binding.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    private String backend = "local";

    @NotBlank
    private String fileExtension = "flv";

    @NotBlank
    private String contentType = "video/x-flv";

    @Valid
    private Local local = new Local();

    @Valid
    private Remote remote = new Remote();

    @Getter
    @Setter
    public static class Local {

        @NotBlank
        private String recordingsPath = "./media/recordings";

        @NotBlank
        private String tempPath = "./media/temp";

        /** Reported as available capacity; the volume may be shared so real free space is not used. */
        @Min(0)
        private long capacityBytes = 100L * 1024 * 1024 * 1024;

        private String publicBaseUrl = "http://localhost:8080/recordings";
    }

    @Getter
    @Setter
    public static class Remote {

        private String bucket = "livestream-recordings";

        private String prefix = "recordings/";

        private String credentialsPath = "";

        private String projectId = "";

        private String cdnDomain = "";

        @Min(1)
        private long signedUrlExpirySeconds = 3600;

        private String storageClass = "NEARLINE";

        private String kmsKeyName = "";

        /** Prefix normalized to either empty or ending with a single slash. */
        public String normalizedPrefix() {
            if (prefix == null || prefix.isBlank()) {
                return "";
            }
            String p = prefix.trim();
            while (p.startsWith("/")) {
                p = p.substring(1);
            }
            return p.endsWith("/") ? p : p + "/";
        }

        public boolean hasCdnDomain() {
            return cdnDomain != null && !cdnDomain.isBlank();
        }
    }
}
