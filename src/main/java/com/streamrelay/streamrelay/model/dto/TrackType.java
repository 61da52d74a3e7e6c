package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Platform track kinds. Declaration order matches the platform's numeric enum values.
 */
public enum TrackType {
    AUDIO,
    VIDEO,
    DATA,
    @JsonEnumDefaultValue
    UNKNOWN
}
