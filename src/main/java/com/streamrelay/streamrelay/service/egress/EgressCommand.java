package com.streamrelay.streamrelay.service.egress;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * External call requested by a transition. Executing it is the orchestrator's job.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EgressCommand {

    public enum Type {
        RESOLVE_TRACKS,
        START_EGRESS,
        STOP_EGRESS
    }

    Type type;
    String room;
    long token;
    long delayMillis;
    String audioTrackId;
    String videoTrackId;
    String egressId;

    public static EgressCommand resolveTracks(String room, long token, long delayMillis) {
        return new EgressCommand(Type.RESOLVE_TRACKS, room, token, delayMillis, null, null, null);
    }

    public static EgressCommand startEgress(String room, long token, String audioTrackId, String videoTrackId) {
        return new EgressCommand(Type.START_EGRESS, room, token, 0L, audioTrackId, videoTrackId, null);
    }

    public static EgressCommand stopEgress(String room, String egressId) {
        return new EgressCommand(Type.STOP_EGRESS, room, 0L, 0L, null, null, egressId);
    }
}
