package com.streamrelay.streamrelay.service.ingress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamrelay.streamrelay.config.LiveKitProperties;
import com.streamrelay.streamrelay.model.dto.IngressInfo;
import com.streamrelay.streamrelay.model.dto.IngressInputType;
import com.streamrelay.streamrelay.model.dto.IngressSession;
import com.streamrelay.streamrelay.util.jwt.LiveKitJwt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Provisions a fresh room with a WHIP or RTMP ingress and a subscribe-only token for watching it.
 */
@Service
public class IngressService {

    private static final Logger logger = LoggerFactory.getLogger(IngressService.class);
    private static final String ROOM_ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ROOM_ID_LENGTH = 8;

    private final RoomProvisioner provisioner;
    private final LiveKitJwt jwt;
    private final LiveKitProperties properties;
    private final ObjectMapper objectMapper;
    private final Supplier<String> roomIds;

    @Autowired
    public IngressService(RoomProvisioner provisioner, LiveKitJwt jwt, LiveKitProperties properties,
                          ObjectMapper objectMapper) {
        this(provisioner, jwt, properties, objectMapper, randomRoomIds());
    }

    IngressService(RoomProvisioner provisioner, LiveKitJwt jwt, LiveKitProperties properties,
                   ObjectMapper objectMapper, Supplier<String> roomIds) {
        this.provisioner = provisioner;
        this.jwt = jwt;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.roomIds = roomIds;
    }

    /**
     * @param identity publisher and viewer identity; blank falls back to the input's default
     * @throws com.streamrelay.streamrelay.exception.PlatformApiException if a platform call fails
     */
    public IngressSession create(IngressInputType input, String identity) {
        String participant = identity == null || identity.isBlank() ? input.getDefaultIdentity() : identity.trim();
        String room = roomIds.get();

        provisioner.createRoom(room, roomMetadata(participant));
        IngressInfo ingress = provisioner.createIngress(input, room, participant);
        logger.info("Created {} ingress {} for room {} (identity={})", input, ingress.getIngressId(), room, participant);

        return IngressSession.builder()
                .room(room)
                .ingress(ingress)
                .rtmpUrl(input == IngressInputType.RTMP ? ingress.getUrl() : null)
                .viewerConnection(new IngressSession.ViewerConnection(
                        properties.getWsUrl(), jwt.generateViewerToken(participant, room)))
                .build();
    }

    private String roomMetadata(String identity) {
        try {
            return objectMapper.writeValueAsString(Map.of("creator_identity", identity));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize room metadata", e);
        }
    }

    private static Supplier<String> randomRoomIds() {
        SecureRandom random = new SecureRandom();
        return () -> {
            StringBuilder id = new StringBuilder(ROOM_ID_LENGTH);
            for (int i = 0; i < ROOM_ID_LENGTH; i++) {
                id.append(ROOM_ID_ALPHABET.charAt(random.nextInt(ROOM_ID_ALPHABET.length())));
            }
            return id.toString();
        };
    }
}
