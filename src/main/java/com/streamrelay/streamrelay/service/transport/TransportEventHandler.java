package com.streamrelay.streamrelay.service.transport;

import com.streamrelay.streamrelay.config.RecordingProperties;
import com.streamrelay.streamrelay.exception.StreamKeyRejectedException;
import com.streamrelay.streamrelay.service.recording.RecordingPipeline;
import com.streamrelay.streamrelay.service.session.SessionRegistry;
import com.streamrelay.streamrelay.util.StreamKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reacts to publish start/end callbacks from the media server.
 */
@Service
public class TransportEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(TransportEventHandler.class);

    private final SessionRegistry sessionRegistry;
    private final RecordingPipeline recordingPipeline;
    private final RecordingProperties recordingProperties;

    public TransportEventHandler(SessionRegistry sessionRegistry,
                                 RecordingPipeline recordingPipeline,
                                 RecordingProperties recordingProperties) {
        this.sessionRegistry = sessionRegistry;
        this.recordingPipeline = recordingPipeline;
        this.recordingProperties = recordingProperties;
    }

    /**
     * Admits a publish. The stream key is the final segment of {@code path}.
     *
     * @return the admitted stream key
     * @throws StreamKeyRejectedException if no stream key can be derived; the media server must
     *         refuse the connection
     */
    public String onPublishStart(String sessionId, String path) {
        String streamKey = StreamKeys.fromPath(path)
                .orElseThrow(() -> new StreamKeyRejectedException(path));
        sessionRegistry.register(streamKey, sessionId);
        logger.info("[prePublish] id={} streamKey={}", sessionId, streamKey);
        return streamKey;
    }

    /**
     * Ends a publish: drops the session and, when recording is enabled, persists its capture in the
     * background.
     */
    public void onPublishEnd(String sessionId, String path, String recordingPath) {
        Optional<String> streamKey = StreamKeys.fromPath(path);
        if (streamKey.isEmpty()) {
            logger.warn("[donePublish] id={} without a stream key in path {}", sessionId, path);
            return;
        }

        String key = streamKey.get();
        boolean removed = sessionRegistry.unregister(key, sessionId);
        logger.info("[donePublish] id={} streamKey={} unregistered={}", sessionId, key, removed);

        if (recordingProperties.isEnabled()) {
            recordingPipeline.persistAsync(key, recordingPath);
        }
    }
}
