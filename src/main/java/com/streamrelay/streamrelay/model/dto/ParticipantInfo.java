package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Optional;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParticipantInfo {
    private String sid;
    private String identity;
    private List<TrackInfo> tracks;

    public Optional<String> firstTrackSid(TrackType type) {
        if (tracks == null) {
            return Optional.empty();
        }
        return tracks.stream()
                .filter(t -> t.kind() == type && t.getSid() != null && !t.getSid().isEmpty())
                .map(TrackInfo::getSid)
                .findFirst();
    }
}
