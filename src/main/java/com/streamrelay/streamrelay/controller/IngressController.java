package com.streamrelay.streamrelay.controller;

import com.streamrelay.streamrelay.model.dto.IngressInputType;
import com.streamrelay.streamrelay.model.dto.IngressSession;
import com.streamrelay.streamrelay.service.ingress.IngressService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Creates a room with an ingress for a publisher and returns the ingest URL and a viewer token.
 */
@RestController
@RequestMapping("/api/ingress")
public class IngressController {

    private final IngressService ingressService;

    public IngressController(IngressService ingressService) {
        this.ingressService = ingressService;
    }

    @PostMapping
    public ResponseEntity<IngressSession> create(@RequestParam(defaultValue = "WHIP") String input,
                                                 @RequestBody(required = false) Map<String, String> body) {
        IngressInputType type = IngressInputType.fromParameter(input);
        String identity = body == null ? null : body.get("identity");
        return ResponseEntity.ok(ingressService.create(type, identity));
    }
}
