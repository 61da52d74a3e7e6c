package com.streamrelay.streamrelay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "recording")
public class RecordingProperties {

    /** Hand captures to storage when a publish ends. */
    private boolean enabled = true;

    @Valid
    private Probe probe = new Probe();

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Getter
    @Setter
    public static class Probe {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Cleanup {
        private boolean enabled = false;

        @Min(1)
        private int maxAgeHours = 24 * 7;

        private String cron = "0 0 * * * *";
    }
}
