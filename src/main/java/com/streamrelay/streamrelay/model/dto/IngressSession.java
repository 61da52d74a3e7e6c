package com.streamrelay.streamrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A freshly provisioned room: where the publisher sends media and how a viewer joins.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngressSession {
    String room;
    IngressInfo ingress;
    /** Full ingest URL, only for RTMP inputs. */
    @JsonProperty("rtmp_url")
    String rtmpUrl;
    @JsonProperty("viewer_connection")
    ViewerConnection viewerConnection;

    @Value
    public static class ViewerConnection {
        @JsonProperty("ws_url")
        String wsUrl;
        String token;
    }
}
