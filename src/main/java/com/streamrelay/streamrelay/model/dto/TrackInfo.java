package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackInfo {
    private String sid;
    private TrackType type;
    private String name;

    /** Track kind; the platform omits its zero value (AUDIO) from JSON, so null reads as audio. */
    public TrackType kind() {
        return type == null ? TrackType.AUDIO : type;
    }
}
