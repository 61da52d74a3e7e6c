package com.streamrelay.streamrelay.service.egress;

public enum EgressPhase {
    IDLE,
    /** Waiting for the room's publisher to expose both an audio and a video track. */
    TRACK_PENDING,
    /** Start call in flight. */
    STARTING,
    ACTIVE
}
