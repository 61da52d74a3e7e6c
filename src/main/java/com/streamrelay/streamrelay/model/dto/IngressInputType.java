package com.streamrelay.streamrelay.model.dto;

import java.util.Locale;

/**
 * Publish protocols an ingress can be created for, with the platform's enum name for each.
 */
public enum IngressInputType {
    RTMP("RTMP_INPUT", "rtmp_publisher"),
    WHIP("WHIP_INPUT", "whip_publisher");

    private final String platformName;
    private final String defaultIdentity;

    IngressInputType(String platformName, String defaultIdentity) {
        this.platformName = platformName;
        this.defaultIdentity = defaultIdentity;
    }

    public String getPlatformName() {
        return platformName;
    }

    public String getDefaultIdentity() {
        return defaultIdentity;
    }

    /**
     * @throws IllegalArgumentException for anything but {@code WHIP} or {@code RTMP}, any case
     */
    public static IngressInputType fromParameter(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (IngressInputType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported ingress input: " + value + " (expected WHIP or RTMP)");
    }
}
