package com.streamrelay.streamrelay.controller;

import com.streamrelay.streamrelay.service.webhook.WebhookReceiver;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private final WebhookReceiver webhookReceiver;

    public WebhookController(WebhookReceiver webhookReceiver) {
        this.webhookReceiver = webhookReceiver;
    }

    /**
     * The body is taken raw: its digest is part of the signature. Once verified, the answer is
     * always a success so the platform does not redeliver.
     */
    @PostMapping("/livekit")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody(required = false) String body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        webhookReceiver.receive(body, authorization);
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
