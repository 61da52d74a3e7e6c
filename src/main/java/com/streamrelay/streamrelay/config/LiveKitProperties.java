package com.streamrelay.streamrelay.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the real-time media platform. The API secret signs outgoing API tokens
 * and verifies incoming webhooks.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "livekit")
public class LiveKitProperties {

    @NotBlank
    private String apiUrl = "http://localhost:7880";

    private String apiKey = "";

    private String apiSecret = "";

    @Min(1)
    private long tokenTtlSeconds = 600;

    /** Client-facing websocket URL handed to viewers together with their token. */
    private String wsUrl = "ws://localhost:7880";

    @Min(1)
    private long viewerTokenTtlSeconds = 21600;
}
