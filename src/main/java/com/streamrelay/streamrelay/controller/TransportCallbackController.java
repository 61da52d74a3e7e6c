package com.streamrelay.streamrelay.controller;

import com.streamrelay.streamrelay.service.transport.TransportEventHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Publish callbacks from the media server. A non-2xx answer to publish-start makes the server
 * refuse the connection.
 */
@RestController
@RequestMapping("/hooks/transport")
public class TransportCallbackController {

    private final TransportEventHandler transportEventHandler;

    public TransportCallbackController(TransportEventHandler transportEventHandler) {
        this.transportEventHandler = transportEventHandler;
    }

    @PostMapping("/publish-start")
    public ResponseEntity<Map<String, String>> publishStart(@RequestParam String sessionId,
                                                            @RequestParam(required = false) String path) {
        String streamKey = transportEventHandler.onPublishStart(sessionId, path);
        return ResponseEntity.ok(Map.of("status", "accepted", "streamKey", streamKey));
    }

    @PostMapping("/publish-end")
    public ResponseEntity<Map<String, String>> publishEnd(@RequestParam String sessionId,
                                                          @RequestParam(required = false) String path,
                                                          @RequestParam(required = false) String recordingPath) {
        transportEventHandler.onPublishEnd(sessionId, path, recordingPath);
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
