package com.streamrelay.streamrelay.service.transport;

import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.exception.StreamKeyRejectedException;
import com.streamrelay.streamrelay.service.recording.RecordingPipeline;
import com.streamrelay.streamrelay.service.session.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TransportEventHandlerTest {

    private SessionRegistry registry;
    private RecordingPipeline pipeline;
    private RecordingProperties recordingProperties;
    private TransportEventHandler handler;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
        pipeline = mock(RecordingPipeline.class);
        recordingProperties = new RecordingProperties();
        handler = new TransportEventHandler(registry, pipeline, recordingProperties);
    }

    @Test
    void testPublishStart_AdmitsFinalPathSegment() {
        assertEquals("abc123", handler.onPublishStart("session-1", "/live/abc123"));
        assertTrue(registry.unregister("abc123"));
    }

    @Test
    void testPublishStart_EmptyKeyIsRejected() {
        assertThrows(StreamKeyRejectedException.class, () -> handler.onPublishStart("session-1", "/live/"));
        assertThrows(StreamKeyRejectedException.class, () -> handler.onPublishStart("session-1", null));
    }

    @Test
    void testPublishEnd_UnregistersAndPersists() {
        handler.onPublishStart("session-1", "/live/abc123");

        handler.onPublishEnd("session-1", "/live/abc123", "/media/temp/abc123.flv");

        assertFalse(registry.unregister("abc123"));
        verify(pipeline).persistAsync("abc123", "/media/temp/abc123.flv");
    }

    @Test
    void testPublishEnd_RecordingDisabled() {
        recordingProperties.setEnabled(false);

        handler.onPublishEnd("session-1", "/live/abc123", null);

        verify(pipeline, never()).persistAsync(anyString(), any());
    }

    @Test
    void testPublishEnd_WithoutKey_DoesNothing() {
        handler.onPublishEnd("session-1", "/live/", null);

        verify(pipeline, never()).persistAsync(any(), any());
    }
}
