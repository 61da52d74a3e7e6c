package com.streamrelay.streamrelay.service.egress;

import com.streamrelay.streamrelay.exception.PlatformApiException;
import com.streamrelay.streamrelay.model.dto.ParticipantInfo;

import java.util.List;

/**
 * Read access to a room's participants and their published tracks. Results are eventually
 * consistent: tracks announced by a webhook may not be listed yet.
 */
public interface ParticipantDirectory {

    /**
     * @throws PlatformApiException if the platform cannot be queried
     */
    List<ParticipantInfo> listParticipants(String room);
}
