package com.streamrelay.streamrelay.service.egress;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Per-room orchestration state. {@code token} identifies one start sequence so that results of an
 * abandoned or superseded sequence are recognized as stale.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EgressState {

    public static final EgressState IDLE = new EgressState(EgressPhase.IDLE, 0L, 0, null);

    EgressPhase phase;
    long token;
    /** Participant lookups made so far in this sequence. */
    int attempts;
    String egressId;

    public static EgressState trackPending(long token, int attempts) {
        return new EgressState(EgressPhase.TRACK_PENDING, token, attempts, null);
    }

    public static EgressState starting(long token, int attempts) {
        return new EgressState(EgressPhase.STARTING, token, attempts, null);
    }

    public static EgressState active(long token, String egressId) {
        return new EgressState(EgressPhase.ACTIVE, token, 0, egressId);
    }

    public boolean isIdle() {
        return phase == EgressPhase.IDLE;
    }

    boolean isSequence(EgressPhase expected, long expectedToken) {
        return phase == expected && token == expectedToken;
    }
}
