package com.streamrelay.streamrelay.controller;

import com.streamrelay.streamrelay.model.StorageMetadata;
import com.streamrelay.streamrelay.model.StorageUsage;
import com.streamrelay.streamrelay.service.storage.LocalStorageBackend;
import com.streamrelay.streamrelay.service.storage.StorageBackend;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Admin API over the selected storage backend.
 */
@RestController
@RequestMapping("/api/recordings")
public class RecordingController {

    private final StorageBackend storageBackend;

    public RecordingController(StorageBackend storageBackend) {
        this.storageBackend = storageBackend;
    }

    @GetMapping
    public ResponseEntity<List<StorageMetadata>> list(@RequestParam(required = false) String streamKey) {
        String filter = streamKey == null || streamKey.isBlank() ? null : streamKey;
        return ResponseEntity.ok(storageBackend.list(filter));
    }

    @GetMapping("/url")
    public ResponseEntity<Map<String, String>> url(@RequestParam String id,
                                                   @RequestParam(required = false) Long expirySeconds) {
        if (expirySeconds != null && expirySeconds <= 0) {
            throw new IllegalArgumentException("expirySeconds must be positive");
        }
        String url = expirySeconds == null
                ? storageBackend.resolveUrl(id)
                : storageBackend.resolveUrl(id, expirySeconds);
        return ResponseEntity.ok(Map.of("url", url));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Boolean>> delete(@RequestParam String id) {
        return ResponseEntity.ok(Map.of("deleted", storageBackend.delete(id)));
    }

    @GetMapping("/usage")
    public ResponseEntity<StorageUsage> usage() {
        return ResponseEntity.ok(storageBackend.usage());
    }

    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanup(@RequestParam(defaultValue = "168") int maxAgeHours) {
        if (!(storageBackend instanceof LocalStorageBackend)) {
            throw new IllegalArgumentException("Cleanup is only supported by the local storage backend");
        }
        if (maxAgeHours < 0) {
            throw new IllegalArgumentException("maxAgeHours must not be negative");
        }
        int deleted = ((LocalStorageBackend) storageBackend).cleanupOldRecordings(maxAgeHours);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }
}
