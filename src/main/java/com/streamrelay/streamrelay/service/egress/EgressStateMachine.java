package com.streamrelay.streamrelay.service.egress;

/**
 * Pure transition function of the per-room egress lifecycle.
 *
 * <pre>
 * IDLE -- video published --------------------------&gt; TRACK_PENDING  [resolve tracks]
 * TRACK_PENDING -- tracks resolved -----------------&gt; STARTING       [start egress]
 * TRACK_PENDING -- unresolved, attempts left -------&gt; TRACK_PENDING  [resolve tracks after delay]
 * TRACK_PENDING -- unresolved, attempts exhausted --&gt; IDLE
 * STARTING -- started ------------------------------&gt; ACTIVE
 * STARTING -- start failed -------------------------&gt; IDLE
 * ACTIVE -- ingress ended --------------------------&gt; IDLE           [stop egress]
 * TRACK_PENDING / STARTING -- ingress ended --------&gt; IDLE
 * </pre>
 *
 * Duplicate publish events outside IDLE change nothing. Outcomes carrying a token that no longer
 * matches the room's sequence are stale and ignored, except a stale "started" whose job is stopped
 * right away so that no job outlives its room's input.
 */
public class EgressStateMachine {

    private final int maxResolveAttempts;
    private final long retryDelayMillis;

    public EgressStateMachine(int maxResolveAttempts, long retryDelayMillis) {
        if (maxResolveAttempts < 1) {
            throw new IllegalArgumentException("maxResolveAttempts must be at least 1");
        }
        this.maxResolveAttempts = maxResolveAttempts;
        this.retryDelayMillis = Math.max(0L, retryDelayMillis);
    }

    /**
     * @param room room the event belongs to
     * @param current current state, {@code null} meaning idle
     * @param event the event to apply
     * @return the next state and the external calls to issue
     */
    public EgressTransition transition(String room, EgressState current, EgressEvent event) {
        EgressState state = current == null ? EgressState.IDLE : current;

        switch (event.getType()) {
            case VIDEO_TRACK_PUBLISHED:
                if (!state.isIdle()) {
                    return EgressTransition.unchanged(state);
                }
                return EgressTransition.to(
                        EgressState.trackPending(event.getToken(), 1),
                        EgressCommand.resolveTracks(room, event.getToken(), 0L));

            case AUDIO_TRACK_PUBLISHED:
                // Audio alone cannot anchor a composite output
                return EgressTransition.unchanged(state);

            case TRACKS_RESOLVED:
                if (!state.isSequence(EgressPhase.TRACK_PENDING, event.getToken())) {
                    return EgressTransition.unchanged(state);
                }
                return EgressTransition.to(
                        EgressState.starting(state.getToken(), state.getAttempts()),
                        EgressCommand.startEgress(room, state.getToken(),
                                event.getAudioTrackId(), event.getVideoTrackId()));

            case TRACKS_UNRESOLVED:
                if (!state.isSequence(EgressPhase.TRACK_PENDING, event.getToken())) {
                    return EgressTransition.unchanged(state);
                }
                if (state.getAttempts() >= maxResolveAttempts) {
                    return EgressTransition.to(EgressState.IDLE);
                }
                return EgressTransition.to(
                        EgressState.trackPending(state.getToken(), state.getAttempts() + 1),
                        EgressCommand.resolveTracks(room, state.getToken(), retryDelayMillis));

            case EGRESS_STARTED:
                if (!state.isSequence(EgressPhase.STARTING, event.getToken())) {
                    return EgressTransition.to(state, EgressCommand.stopEgress(room, event.getEgressId()));
                }
                return EgressTransition.to(EgressState.active(state.getToken(), event.getEgressId()));

            case EGRESS_START_FAILED:
                if (!state.isSequence(EgressPhase.STARTING, event.getToken())) {
                    return EgressTransition.unchanged(state);
                }
                return EgressTransition.to(EgressState.IDLE);

            case INGRESS_ENDED:
                if (state.getPhase() == EgressPhase.ACTIVE) {
                    // Mapping goes away whether or not the stop call succeeds
                    return EgressTransition.to(EgressState.IDLE, EgressCommand.stopEgress(room, state.getEgressId()));
                }
                return EgressTransition.to(EgressState.IDLE);

            default:
                return EgressTransition.unchanged(state);
        }
    }

    public int getMaxResolveAttempts() {
        return maxResolveAttempts;
    }

    public long getRetryDelayMillis() {
        return retryDelayMillis;
    }
}
