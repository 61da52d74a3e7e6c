package com.streamrelay.streamrelay.controller;

import com.streamrelay.streamrelay.config.exception.GlobalExceptionHandler;
import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.service.recording.RecordingPipeline;
import com.streamrelay.streamrelay.service.session.SessionRegistry;
import com.streamrelay.streamrelay.service.transport.TransportEventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TransportCallbackControllerTest {

    private RecordingPipeline pipeline;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        pipeline = mock(RecordingPipeline.class);
        TransportEventHandler handler = new TransportEventHandler(new SessionRegistry(), pipeline, new RecordingProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(new TransportCallbackController(handler))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testPublishStart_Accepted() throws Exception {
        mockMvc.perform(post("/hooks/transport/publish-start")
                        .param("sessionId", "session-1")
                        .param("path", "/live/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.streamKey").value("abc123"));
    }

    @Test
    void testPublishStart_EmptyKeyForbidden() throws Exception {
        mockMvc.perform(post("/hooks/transport/publish-start")
                        .param("sessionId", "session-1")
                        .param("path", "/live/"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("StreamKeyRejectedException"));
    }

    @Test
    void testPublishStart_MissingSessionId() throws Exception {
        mockMvc.perform(post("/hooks/transport/publish-start").param("path", "/live/abc123"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testPublishEnd_HandsCaptureToPipeline() throws Exception {
        mockMvc.perform(post("/hooks/transport/publish-end")
                        .param("sessionId", "session-1")
                        .param("path", "/live/abc123")
                        .param("recordingPath", "/media/temp/abc123.flv"))
                .andExpect(status().isOk());

        verify(pipeline).persistAsync("abc123", "/media/temp/abc123.flv");
    }
}
