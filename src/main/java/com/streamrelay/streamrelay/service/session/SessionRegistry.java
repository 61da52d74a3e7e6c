package com.streamrelay.streamrelay.service.session;

import com.streamrelay.streamrelay.exception.StreamKeyRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps each active stream key to the media server's session id. One registration per key: a new
 * publish under the same key supersedes the previous one.
 *
 * <p>Process-local and intentionally not queryable. Sessions cannot outlive the process, so an
 * empty registry after restart is correct. Every mutation is a single atomic map operation.
 */
@Component
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    /**
     * @return the session id this registration superseded, if any
     * @throws StreamKeyRejectedException if the stream key is absent or blank; nothing is registered
     */
    public Optional<String> register(String streamKey, String transportSessionId) {
        if (streamKey == null || streamKey.isBlank()) {
            throw new StreamKeyRejectedException(String.valueOf(streamKey));
        }
        String previous = sessions.put(streamKey, transportSessionId);
        if (previous != null && !previous.equals(transportSessionId)) {
            logger.info("Session {} superseded by {} for stream key {}", previous, transportSessionId, streamKey);
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Removes the mapping for {@code streamKey}. Absent mappings are not an error.
     *
     * @return whether a mapping was removed
     */
    public boolean unregister(String streamKey) {
        if (streamKey == null) {
            return false;
        }
        return sessions.remove(streamKey) != null;
    }

    /**
     * Removes the mapping only while it still belongs to {@code transportSessionId}, so the end of a
     * superseded session does not drop the publish that replaced it.
     *
     * @return whether a mapping was removed
     */
    public boolean unregister(String streamKey, String transportSessionId) {
        if (streamKey == null) {
            return false;
        }
        if (transportSessionId == null) {
            return unregister(streamKey);
        }
        return sessions.remove(streamKey, transportSessionId);
    }
}
