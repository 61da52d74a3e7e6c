package com.streamrelay.streamrelay.service.egress;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Inputs of the egress state machine: webhook events plus the outcomes of the external calls the
 * machine asked for.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EgressEvent {

    public enum Type {
        VIDEO_TRACK_PUBLISHED,
        AUDIO_TRACK_PUBLISHED,
        TRACKS_RESOLVED,
        TRACKS_UNRESOLVED,
        EGRESS_STARTED,
        EGRESS_START_FAILED,
        INGRESS_ENDED
    }

    Type type;
    long token;
    String audioTrackId;
    String videoTrackId;
    String egressId;

    /** @param token identifier for the start sequence this event may begin */
    public static EgressEvent videoTrackPublished(long token) {
        return new EgressEvent(Type.VIDEO_TRACK_PUBLISHED, token, null, null, null);
    }

    public static EgressEvent audioTrackPublished() {
        return new EgressEvent(Type.AUDIO_TRACK_PUBLISHED, 0L, null, null, null);
    }

    public static EgressEvent tracksResolved(long token, String audioTrackId, String videoTrackId) {
        return new EgressEvent(Type.TRACKS_RESOLVED, token, audioTrackId, videoTrackId, null);
    }

    public static EgressEvent tracksUnresolved(long token) {
        return new EgressEvent(Type.TRACKS_UNRESOLVED, token, null, null, null);
    }

    public static EgressEvent egressStarted(long token, String egressId) {
        return new EgressEvent(Type.EGRESS_STARTED, token, null, null, egressId);
    }

    public static EgressEvent egressStartFailed(long token) {
        return new EgressEvent(Type.EGRESS_START_FAILED, token, null, null, null);
    }

    public static EgressEvent ingressEnded() {
        return new EgressEvent(Type.INGRESS_ENDED, 0L, null, null, null);
    }
}
