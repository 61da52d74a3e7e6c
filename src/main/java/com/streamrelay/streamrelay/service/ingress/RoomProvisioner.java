package com.streamrelay.streamrelay.service.ingress;

import com.streamrelay.streamrelay.model.dto.IngressInfo;
import com.streamrelay.streamrelay.model.dto.IngressInputType;

/**
 * Platform calls that create a room and the ingress publishing into it.
 */
public interface RoomProvisioner {

    /**
     * @throws com.streamrelay.streamrelay.exception.PlatformApiException if the room is not created
     */
    void createRoom(String room, String metadata);

    /**
     * @return the created ingress, including its ingest URL
     * @throws com.streamrelay.streamrelay.exception.PlatformApiException if the ingress is not created
     */
    IngressInfo createIngress(IngressInputType input, String room, String participantIdentity);
}
