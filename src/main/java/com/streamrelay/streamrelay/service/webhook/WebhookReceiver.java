package com.streamrelay.streamrelay.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.streamrelay.streamrelay.config.EgressProperties;
import com.streamrelay.streamrelay.exception.MalformedWebhookException;
import com.streamrelay.streamrelay.model.dto.WebhookEvent;
import com.streamrelay.streamrelay.service.egress.EgressOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for platform webhooks: verify, parse, then route the events the egress orchestrator
 * reacts to. Nothing is parsed or mutated before verification passes.
 */
@Service
public class WebhookReceiver {

    private static final Logger log = LoggerFactory.getLogger(WebhookReceiver.class);

    private final WebhookVerifier verifier;
    private final EgressOrchestrator orchestrator;
    private final EgressProperties egressProperties;
    private final ObjectReader reader;

    public WebhookReceiver(WebhookVerifier verifier,
                           EgressOrchestrator orchestrator,
                           EgressProperties egressProperties,
                           ObjectMapper objectMapper) {
        this.verifier = verifier;
        this.orchestrator = orchestrator;
        this.egressProperties = egressProperties;
        this.reader = objectMapper.readerFor(WebhookEvent.class)
                .with(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws com.streamrelay.streamrelay.exception.WebhookVerificationException if the signature
     *         does not verify
     * @throws MalformedWebhookException if the body cannot be read as a webhook event
     */
    public WebhookEvent receive(String body, String authorizationHeader) {
        verifier.verify(body, authorizationHeader);
        WebhookEvent event = parse(body);

        log.info("[webhook] event={} room={} id={}", event.getEvent(), event.roomName(), event.getId());
        if (!egressProperties.isEnabled()) {
            return event;
        }

        switch (event.getEvent()) {
            case WebhookEvent.TRACK_PUBLISHED:
                if (event.getTrack() == null) {
                    throw new MalformedWebhookException("track_published without track", null);
                }
                orchestrator.onTrackPublished(requireRoom(event), event.getTrack().kind());
                break;
            case WebhookEvent.INGRESS_ENDED:
                orchestrator.onIngressEnded(requireRoom(event));
                break;
            default:
                log.debug("Ignoring webhook event {}", event.getEvent());
        }
        return event;
    }

    private WebhookEvent parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedWebhookException("Empty webhook body", null);
        }
        WebhookEvent event;
        try {
            event = reader.readValue(body);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("Unreadable webhook body: " + e.getOriginalMessage(), e);
        }
        if (event == null || event.getEvent() == null || event.getEvent().isBlank()) {
            throw new MalformedWebhookException("Webhook body has no event name", null);
        }
        return event;
    }

    private static String requireRoom(WebhookEvent event) {
        String room = event.roomName();
        if (room == null) {
            throw new MalformedWebhookException(event.getEvent() + " without room name", null);
        }
        return room;
    }
}
