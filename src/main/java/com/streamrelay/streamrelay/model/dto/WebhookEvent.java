package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Webhook payload from the media platform. Only the fields this service reacts to are mapped.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookEvent {

    public static final String TRACK_PUBLISHED = "track_published";
    public static final String INGRESS_ENDED = "ingress_ended";

    private String id;
    private String event;
    private RoomInfo room;
    private ParticipantInfo participant;
    private TrackInfo track;
    @JsonAlias("ingress_info")
    private IngressInfo ingressInfo;

    /** Room name from the room object, or from the ingress info for ingress events. */
    public String roomName() {
        if (room != null && room.getName() != null && !room.getName().isEmpty()) {
            return room.getName();
        }
        if (ingressInfo != null && ingressInfo.getRoomName() != null && !ingressInfo.getRoomName().isEmpty()) {
            return ingressInfo.getRoomName();
        }
        return null;
    }
}
