package com.streamrelay.streamrelay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "events")
public class EventProperties {

    @Valid
    private Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Kafka {
        private boolean enabled = false;

        @NotBlank
        private String topic = "recording-stored";
    }
}
