package com.streamrelay.streamrelay.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "egress")
public class EgressProperties {

    private boolean enabled = true;

    /** Output URLs (e.g. RTMP ingest endpoints) the composite stream is pushed to. */
    private List<String> streamUrls = new ArrayList<>();

    /**
     * Participant lookups made before a start is abandoned. Track lists become queryable only
     * after a propagation delay, so the default is the initial lookup plus one retry.
     */
    @Min(1)
    private int resolveAttempts = 2;

    @Min(0)
    private long resolveRetryDelayMs = 3000;
}
