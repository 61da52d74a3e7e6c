package com.streamrelay.streamrelay.service.recording;

import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.service.storage.LocalStorageBackend;
import com.streamrelay.streamrelay.service.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes old local recordings. Does nothing for the remote backend, where retention
 * belongs to bucket lifecycle rules.
 */
@Component
public class RecordingCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RecordingCleanupScheduler.class);

    private final StorageBackend storageBackend;
    private final RecordingProperties properties;

    public RecordingCleanupScheduler(StorageBackend storageBackend, RecordingProperties properties) {
        this.storageBackend = storageBackend;
        this.properties = properties;
    }

    @Scheduled(cron = "${recording.cleanup.cron:0 0 * * * *}")
    public void cleanup() {
        if (!properties.getCleanup().isEnabled() || !(storageBackend instanceof LocalStorageBackend)) {
            return;
        }
        int maxAgeHours = properties.getCleanup().getMaxAgeHours();
        int deleted = ((LocalStorageBackend) storageBackend).cleanupOldRecordings(maxAgeHours);
        logger.info("[Cleanup] Removed {} recordings older than {}h", deleted, maxAgeHours);
    }
}
