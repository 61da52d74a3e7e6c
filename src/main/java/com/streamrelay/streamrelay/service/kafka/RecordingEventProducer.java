package com.streamrelay.streamrelay.service.kafka;

import com.streamrelay.streamrelay.config.EventProperties;
import com.streamrelay.streamrelay.model.StorageMetadata;
import com.streamrelay.streamrelay.model.StorageResult;
import com.streamrelay.streamrelay.model.dto.RecordingStoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "events.kafka", name = "enabled", havingValue = "true")
public class RecordingEventProducer {

    private static final Logger logger = LoggerFactory.getLogger(RecordingEventProducer.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public RecordingEventProducer(KafkaTemplate<String, Object> kafkaTemplate, EventProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getKafka().getTopic();
    }

    /**
     * Publishes a notification for a successful save. Failures are logged and never propagate to
     * the save that triggered them.
     */
    public void send(StorageResult result) {
        StorageMetadata metadata = result.getMetadata();
        RecordingStoredEvent event = RecordingStoredEvent.builder()
                .streamKey(metadata.getStreamKey())
                .fileName(metadata.getFileName())
                .fileSize(metadata.getFileSize())
                .durationSeconds(metadata.getDuration())
                .url(result.getUrl())
                .location(result.getFilePath())
                .uploadTime(metadata.getUploadTime() == null ? null : metadata.getUploadTime().toString())
                .build();

        try {
            kafkaTemplate.send(topic, metadata.getStreamKey(), event)
                    .whenComplete((sent, ex) -> {
                        if (ex != null) {
                            logger.error("Failed to publish recording event for {}: {}",
                                    metadata.getFileName(), ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            logger.error("Failed to publish recording event for {}: {}", metadata.getFileName(), e.getMessage());
        }
    }
}
