package com.streamrelay.streamrelay.service.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamrelay.streamrelay.config.EgressProperties;
import com.streamrelay.streamrelay.exception.MalformedWebhookException;
import com.streamrelay.streamrelay.exception.WebhookVerificationException;
import com.streamrelay.streamrelay.model.dto.TrackType;
import com.streamrelay.streamrelay.service.egress.EgressOrchestrator;
import com.streamrelay.streamrelay.util.jwt.LiveKitJwt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class WebhookReceiverTest {

    private EgressOrchestrator orchestrator;
    private EgressProperties egressProperties;
    private WebhookReceiver receiver;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EgressOrchestrator.class);
        egressProperties = new EgressProperties();
        receiver = new WebhookReceiver(
                new WebhookVerifier(new LiveKitJwt(WebhookVerifierTest.properties())),
                orchestrator, egressProperties, new ObjectMapper());
    }

    private void deliver(String body) {
        receiver.receive(body, WebhookVerifierTest.sign(body, WebhookVerifierTest.API_KEY,
                WebhookVerifierTest.API_SECRET));
    }

    @Test
    void testReceive_VideoTrackPublished() {
        deliver("{\"event\":\"track_published\",\"room\":{\"name\":\"room-1\"},"
                + "\"track\":{\"sid\":\"TR_V\",\"type\":\"VIDEO\"},\"createdAt\":\"1700000000\"}");

        verify(orchestrator).onTrackPublished("room-1", TrackType.VIDEO);
    }

    @Test
    void testReceive_AudioTrackWithOmittedType() {
        deliver("{\"event\":\"track_published\",\"room\":{\"name\":\"room-1\"},\"track\":{\"sid\":\"TR_A\"}}");

        verify(orchestrator).onTrackPublished("room-1", TrackType.AUDIO);
    }

    @Test
    void testReceive_UnknownTrackType() {
        deliver("{\"event\":\"track_published\",\"room\":{\"name\":\"room-1\"},"
                + "\"track\":{\"sid\":\"TR_X\",\"type\":\"HOLOGRAM\"}}");

        verify(orchestrator).onTrackPublished("room-1", TrackType.UNKNOWN);
    }

    @Test
    void testReceive_IngressEndedUsesIngressRoom() {
        deliver("{\"event\":\"ingress_ended\",\"ingress_info\":{\"ingress_id\":\"IN_1\",\"room_name\":\"room-9\"}}");

        verify(orchestrator).onIngressEnded("room-9");
    }

    @Test
    void testReceive_OtherEventsAreAcknowledged() {
        deliver("{\"event\":\"participant_joined\",\"room\":{\"name\":\"room-1\"}}");

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testReceive_BadSignature_NoStateChange() {
        String body = "{\"event\":\"ingress_ended\",\"room\":{\"name\":\"room-1\"}}";

        assertThrows(WebhookVerificationException.class, () -> receiver.receive(body, "bogus"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testReceive_MalformedBody() {
        assertThrows(MalformedWebhookException.class, () -> deliver("{not json"));
        assertThrows(MalformedWebhookException.class, () -> deliver("{\"room\":{\"name\":\"room-1\"}}"));
        assertThrows(MalformedWebhookException.class, () -> deliver("{\"event\":\"ingress_ended\"}"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testReceive_EgressDisabled_OnlyAcknowledges() {
        egressProperties.setEnabled(false);

        deliver("{\"event\":\"track_published\",\"room\":{\"name\":\"room-1\"},\"track\":{\"type\":\"VIDEO\"}}");

        verifyNoInteractions(orchestrator);
    }
}
