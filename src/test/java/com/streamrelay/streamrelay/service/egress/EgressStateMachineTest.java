package com.streamrelay.streamrelay.service.egress;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EgressStateMachineTest {

    private static final String ROOM = "room-1";

    private final EgressStateMachine machine = new EgressStateMachine(2, 3000L);

    @Test
    void testVideoPublished_FromIdle_StartsLookup() {
        EgressTransition t = machine.transition(ROOM, null, EgressEvent.videoTrackPublished(7L));

        assertEquals(EgressState.trackPending(7L, 1), t.getNext());
        assertEquals(List.of(EgressCommand.resolveTracks(ROOM, 7L, 0L)), t.getCommands());
    }

    @Test
    void testVideoPublished_OutsideIdle_IsNoOp() {
        for (EgressState state : List.of(EgressState.trackPending(1L, 1), EgressState.starting(1L, 1),
                EgressState.active(1L, "EG_1"))) {
            EgressTransition t = machine.transition(ROOM, state, EgressEvent.videoTrackPublished(2L));

            assertEquals(state, t.getNext());
            assertTrue(t.getCommands().isEmpty());
        }
    }

    @Test
    void testAudioPublished_IsIgnored() {
        EgressTransition t = machine.transition(ROOM, null, EgressEvent.audioTrackPublished());

        assertTrue(t.getNext().isIdle());
        assertTrue(t.getCommands().isEmpty());
    }

    @Test
    void testTracksResolved_IssuesSingleStart() {
        EgressTransition t = machine.transition(ROOM, EgressState.trackPending(7L, 1),
                EgressEvent.tracksResolved(7L, "TR_A", "TR_V"));

        assertEquals(EgressPhase.STARTING, t.getNext().getPhase());
        assertEquals(List.of(EgressCommand.startEgress(ROOM, 7L, "TR_A", "TR_V")), t.getCommands());
    }

    @Test
    void testTracksUnresolved_RetriesOnceThenAbandons() {
        EgressTransition retry = machine.transition(ROOM, EgressState.trackPending(7L, 1),
                EgressEvent.tracksUnresolved(7L));

        assertEquals(EgressState.trackPending(7L, 2), retry.getNext());
        assertEquals(List.of(EgressCommand.resolveTracks(ROOM, 7L, 3000L)), retry.getCommands());

        EgressTransition abandon = machine.transition(ROOM, retry.getNext(), EgressEvent.tracksUnresolved(7L));

        assertTrue(abandon.getNext().isIdle());
        assertTrue(abandon.getCommands().isEmpty());
    }

    @Test
    void testStaleLookupResult_IsIgnored() {
        EgressState current = EgressState.trackPending(8L, 1);

        EgressTransition t = machine.transition(ROOM, current, EgressEvent.tracksResolved(7L, "A", "V"));

        assertEquals(current, t.getNext());
        assertTrue(t.getCommands().isEmpty());
    }

    @Test
    void testEgressStarted_RecordsJob() {
        EgressTransition t = machine.transition(ROOM, EgressState.starting(7L, 1),
                EgressEvent.egressStarted(7L, "EG_1"));

        assertEquals(EgressState.active(7L, "EG_1"), t.getNext());
        assertTrue(t.getCommands().isEmpty());
    }

    @Test
    void testEgressStarted_AfterIngressEnded_StopsLateJob() {
        EgressTransition t = machine.transition(ROOM, null, EgressEvent.egressStarted(7L, "EG_LATE"));

        assertTrue(t.getNext().isIdle());
        assertEquals(List.of(EgressCommand.stopEgress(ROOM, "EG_LATE")), t.getCommands());
    }

    @Test
    void testEgressStartFailed_ReturnsToIdle() {
        EgressTransition t = machine.transition(ROOM, EgressState.starting(7L, 1), EgressEvent.egressStartFailed(7L));

        assertTrue(t.getNext().isIdle());
    }

    @Test
    void testIngressEnded_StopsActiveJobOnce() {
        EgressTransition t = machine.transition(ROOM, EgressState.active(7L, "EG_1"), EgressEvent.ingressEnded());

        assertTrue(t.getNext().isIdle());
        assertEquals(List.of(EgressCommand.stopEgress(ROOM, "EG_1")), t.getCommands());
    }

    @Test
    void testIngressEnded_WithoutJob_IsNoOp() {
        EgressTransition idle = machine.transition(ROOM, null, EgressEvent.ingressEnded());
        EgressTransition pending = machine.transition(ROOM, EgressState.trackPending(7L, 1), EgressEvent.ingressEnded());

        assertTrue(idle.getNext().isIdle());
        assertTrue(idle.getCommands().isEmpty());
        assertTrue(pending.getNext().isIdle());
        assertTrue(pending.getCommands().isEmpty());
    }

    @Test
    void testConstructor_RejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new EgressStateMachine(0, 100L));
    }
}
