package com.streamrelay.streamrelay.service.recording;

import com.streamrelay.streamrelay.config.StorageProperties;
import com.streamrelay.streamrelay.model.RecordingDetails;
import com.streamrelay.streamrelay.model.StorageResult;
import com.streamrelay.streamrelay.service.kafka.RecordingEventProducer;
import com.streamrelay.streamrelay.service.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Hands a finished capture to the selected storage backend.
 */
@Service
public class RecordingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RecordingPipeline.class);

    private final StorageBackend storageBackend;
    private final RecordingProbe probe;
    private final Optional<RecordingEventProducer> eventProducer;
    private final Path tempRoot;
    private final String extension;

    public RecordingPipeline(StorageBackend storageBackend,
                             RecordingProbe probe,
                             Optional<RecordingEventProducer> eventProducer,
                             StorageProperties storageProperties) {
        this.storageBackend = storageBackend;
        this.probe = probe;
        this.eventProducer = eventProducer;
        this.tempRoot = Paths.get(storageProperties.getLocal().getTempPath()).toAbsolutePath().normalize();
        this.extension = storageProperties.getFileExtension();
    }

    /**
     * Persists the capture of a finished session on the task executor.
     *
     * @param recordingPath capture path reported by the media server; {@code null} or a path
     *                      outside the temp directory falls back to {@code <temp>/<streamKey>.<ext>}
     */
    @Async
    public CompletableFuture<StorageResult> persistAsync(String streamKey, String recordingPath) {
        return CompletableFuture.completedFuture(persist(streamKey, recordingPath));
    }

    public StorageResult persist(String streamKey, String recordingPath) {
        Path capture = resolveCapture(streamKey, recordingPath);
        RecordingDetails details = Files.isRegularFile(capture) ? probe.probe(capture) : RecordingDetails.NONE;

        StorageResult result = storageBackend.save(capture, streamKey, details);
        if (result.isSuccess()) {
            logger.info("Recording stored for stream {}: {}", streamKey, result.getFilePath());
            eventProducer.ifPresent(producer -> producer.send(result));
        } else {
            logger.warn("Recording not stored for stream {}: {}", streamKey, result.getError());
            discardThumbnail(details);
        }
        return result;
    }

    Path resolveCapture(String streamKey, String recordingPath) {
        if (recordingPath != null && !recordingPath.isBlank()) {
            Path reported = Paths.get(recordingPath).toAbsolutePath().normalize();
            if (reported.startsWith(tempRoot)) {
                return reported;
            }
            logger.warn("Ignoring capture path outside {}: {}", tempRoot, recordingPath);
        }
        return tempRoot.resolve(streamKey + "." + extension);
    }

    private static void discardThumbnail(RecordingDetails details) {
        if (details.getThumbnailPath() == null) {
            return;
        }
        try {
            Files.deleteIfExists(Paths.get(details.getThumbnailPath()));
        } catch (IOException e) {
            logger.debug("Could not remove thumbnail {}: {}", details.getThumbnailPath(), e.getMessage());
        }
    }
}
