package com.streamrelay.streamrelay.service.livekit;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.streamrelay.streamrelay.config.EgressProperties;
import com.streamrelay.streamrelay.config.LiveKitProperties;
import com.streamrelay.streamrelay.exception.PlatformApiException;
import com.streamrelay.streamrelay.model.dto.IngressInfo;
import com.streamrelay.streamrelay.model.dto.IngressInputType;
import com.streamrelay.streamrelay.model.dto.ParticipantInfo;
import com.streamrelay.streamrelay.service.egress.EgressClient;
import com.streamrelay.streamrelay.service.egress.ParticipantDirectory;
import com.streamrelay.streamrelay.service.ingress.RoomProvisioner;
import com.streamrelay.streamrelay.util.jwt.LiveKitJwt;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server API client of the media platform over its Twirp JSON transport. Covers the participant
 * lookup and the track composite egress calls the orchestrator needs, plus room and ingress
 * creation.
 */
@Component
public class LiveKitApiClient implements ParticipantDirectory, EgressClient, RoomProvisioner {

    private static final Logger log = LoggerFactory.getLogger(LiveKitApiClient.class);

    static final String LIST_PARTICIPANTS = "/twirp/livekit.RoomService/ListParticipants";
    static final String START_TRACK_COMPOSITE = "/twirp/livekit.Egress/StartTrackCompositeEgress";
    static final String STOP_EGRESS = "/twirp/livekit.Egress/StopEgress";
    static final String CREATE_ROOM = "/twirp/livekit.RoomService/CreateRoom";
    static final String CREATE_INGRESS = "/twirp/livekit.Ingress/CreateIngress";

    private final RestClient restClient;
    private final LiveKitJwt jwt;
    private final EgressProperties egressProperties;

    public LiveKitApiClient(RestClient.Builder restClientBuilder,
                            LiveKitProperties properties,
                            EgressProperties egressProperties,
                            LiveKitJwt jwt) {
        this.restClient = restClientBuilder.baseUrl(properties.getApiUrl()).build();
        this.jwt = jwt;
        this.egressProperties = egressProperties;
    }

    @Override
    public List<ParticipantInfo> listParticipants(String room) {
        Map<String, Object> grant = new LinkedHashMap<>();
        grant.put("roomAdmin", true);
        grant.put("room", room);

        ListParticipantsResponse response = post("ListParticipants", LIST_PARTICIPANTS,
                Map.of("room", room), grant, ListParticipantsResponse.class);
        if (response == null || response.getParticipants() == null) {
            return List.of();
        }
        return response.getParticipants();
    }

    @Override
    public String startTrackComposite(String room, String audioTrackId, String videoTrackId) {
        List<String> urls = egressProperties.getStreamUrls();
        if (urls == null || urls.isEmpty()) {
            throw new PlatformApiException("StartTrackCompositeEgress", "no egress.stream-urls configured", null);
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("room_name", room);
        request.put("audio_track_id", audioTrackId);
        request.put("video_track_id", videoTrackId);
        request.put("stream_outputs", List.of(Map.of("protocol", "RTMP", "urls", urls)));

        EgressInfo info = post("StartTrackCompositeEgress", START_TRACK_COMPOSITE,
                request, Map.of("roomRecord", true), EgressInfo.class);
        if (info == null || info.getEgressId() == null || info.getEgressId().isEmpty()) {
            throw new PlatformApiException("StartTrackCompositeEgress", "response carried no egress id", null);
        }
        return info.getEgressId();
    }

    @Override
    public void stopEgress(String egressId) {
        post("StopEgress", STOP_EGRESS, Map.of("egress_id", egressId), Map.of("roomRecord", true), EgressInfo.class);
    }

    @Override
    public void createRoom(String room, String metadata) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("name", room);
        if (metadata != null) {
            request.put("metadata", metadata);
        }
        post("CreateRoom", CREATE_ROOM, request, Map.of("roomCreate", true), Map.class);
    }

    @Override
    public IngressInfo createIngress(IngressInputType input, String room, String participantIdentity) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("input_type", input.getPlatformName());
        request.put("name", room);
        request.put("room_name", room);
        request.put("participant_identity", participantIdentity);
        request.put("participant_name", participantIdentity);
        request.put("bypass_transcoding", true);

        IngressInfo info = post("CreateIngress", CREATE_INGRESS, request, Map.of("ingressAdmin", true), IngressInfo.class);
        if (info == null || info.getIngressId() == null || info.getIngressId().isEmpty()) {
            throw new PlatformApiException("CreateIngress", "response carried no ingress id", null);
        }
        return info;
    }

    private <T> T post(String operation, String path, Object body, Map<String, Object> grant, Class<T> responseType) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt.generateApiToken(grant))
                    .body(body)
                    .retrieve()
                    .body(responseType);
        } catch (RestClientException e) {
            log.debug("{} call to {} failed", operation, path, e);
            throw new PlatformApiException(operation, e.getMessage(), e);
        }
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ListParticipantsResponse {
        private List<ParticipantInfo> participants;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EgressInfo {
        @JsonAlias("egress_id")
        private String egressId;
        private String status;
    }
}
