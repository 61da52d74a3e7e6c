package com.streamrelay.streamrelay.service.session;

import com.streamrelay.streamrelay.exception.StreamKeyRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
    }

    @Test
    void testRegisterThenUnregister_SecondUnregisterIsNoOp() {
        registry.register("abc123", "session-1");

        assertTrue(registry.unregister("abc123"));
        assertFalse(registry.unregister("abc123"));
    }

    @Test
    void testRegister_RejectsEmptyKey() {
        assertThrows(StreamKeyRejectedException.class, () -> registry.register("", "session-1"));
        assertThrows(StreamKeyRejectedException.class, () -> registry.register("  ", "session-1"));
        assertThrows(StreamKeyRejectedException.class, () -> registry.register(null, "session-1"));
    }

    @Test
    void testRegister_SupersedesPreviousSession() {
        assertEquals(Optional.empty(), registry.register("abc123", "session-1"));
        assertEquals(Optional.of("session-1"), registry.register("abc123", "session-2"));
    }

    @Test
    void testUnregisterWithSession_IgnoresSupersededSession() {
        registry.register("abc123", "session-1");
        registry.register("abc123", "session-2");

        assertFalse(registry.unregister("abc123", "session-1"), "stale end must not drop the new publish");
        assertTrue(registry.unregister("abc123", "session-2"));
    }

    @Test
    void testUnregisterWithoutSession_RemovesUnconditionally() {
        registry.register("abc123", "session-1");

        assertTrue(registry.unregister("abc123", null));
    }
}
