package com.streamrelay.streamrelay.service.storage;

import com.streamrelay.streamrelay.exception.RecordingNotFoundException;
import com.streamrelay.streamrelay.model.RecordingDetails;
import com.streamrelay.streamrelay.model.StorageMetadata;
import com.streamrelay.streamrelay.model.StorageResult;
import com.streamrelay.streamrelay.model.StorageUsage;

import java.nio.file.Path;
import java.util.List;

/**
 * Persistence contract for finished recordings.
 *
 * <p>Implementations must not throw for expected failures from {@link #save}, {@link #delete},
 * {@link #list} or {@link #usage}: they report them through the return value and log the cause.
 * Calls for different stream keys may run concurrently and must not assume exclusive access to the
 * underlying store.
 */
public interface StorageBackend {

    /**
     * Persists a finished capture under a name derived from {@code streamKey} and the current time.
     * On success the temp file no longer exists and {@code metadata.fileSize} equals the persisted
     * object's size.
     *
     * @param tempFile capture produced by the media server
     * @param streamKey stream key the capture belongs to
     * @param details optional caller-supplied metadata
     * @return the outcome; {@code success=false} with a {@code TempFileNotFound} error when the
     *         capture is missing
     */
    StorageResult save(Path tempFile, String streamKey, RecordingDetails details);

    /**
     * Resolves a URL for a stored recording using the backend's default expiry.
     *
     * @throws RecordingNotFoundException if the recording does not exist
     */
    String resolveUrl(String identifier);

    /**
     * Resolves a URL for a stored recording. Backends with access control return a URL valid for at
     * most {@code expirySeconds} unless a public front door is configured, in which case the stable
     * public URL is returned and the expiry is ignored.
     *
     * @throws RecordingNotFoundException if the recording does not exist
     */
    String resolveUrl(String identifier, long expirySeconds);

    /**
     * @return {@code true} if the recording was deleted, {@code false} if it was already absent or
     *         the deletion failed
     */
    boolean delete(String identifier);

    /**
     * @param streamKeyFilter optional stream key; {@code null} lists everything
     * @return recordings sorted by upload time, newest first; empty on enumeration failure
     */
    List<StorageMetadata> list(String streamKeyFilter);

    /**
     * @return bytes used and the capacity reported as available; zeros on failure
     */
    StorageUsage usage();
}
