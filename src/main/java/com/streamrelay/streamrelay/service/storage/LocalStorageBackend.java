package com.streamrelay.streamrelay.service.storage;

import com.streamrelay.streamrelay.config.StorageProperties;
import com.streamrelay.streamrelay.exception.RecordingNotFoundException;
import com.streamrelay.streamrelay.exception.StorageConfigurationException;
import com.streamrelay.streamrelay.model.RecordingDetails;
import com.streamrelay.streamrelay.model.StorageMetadata;
import com.streamrelay.streamrelay.model.StorageResult;
import com.streamrelay.streamrelay.model.StorageUsage;
import com.streamrelay.streamrelay.util.RecordingFileNames;
import com.streamrelay.streamrelay.util.StreamKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores recordings as flat files under the configured recordings root.
 *
 * <p>Persistence is a rename, so a recording never becomes visible half-written. When the temp
 * directory lives on another volume the capture is first copied to a hidden part file inside the
 * recordings root and then renamed. The final name is reserved with an empty placeholder first,
 * which a listing taken during the move reports with size zero.
 */
public class LocalStorageBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageBackend.class);
    static final String THUMBNAILS_DIR = "thumbnails";
    private static final String PART_SUFFIX = ".part";

    private final Path recordingsRoot;
    private final Path tempRoot;
    private final String extension;
    private final long capacityBytes;
    private final String publicBaseUrl;
    private final Clock clock;

    public LocalStorageBackend(StorageProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public LocalStorageBackend(StorageProperties properties, Clock clock) {
        StorageProperties.Local local = properties.getLocal();
        this.recordingsRoot = Paths.get(local.getRecordingsPath()).toAbsolutePath().normalize();
        this.tempRoot = Paths.get(local.getTempPath()).toAbsolutePath().normalize();
        this.extension = properties.getFileExtension();
        this.capacityBytes = local.getCapacityBytes();
        this.publicBaseUrl = trimTrailingSlash(local.getPublicBaseUrl());
        this.clock = clock;
        initializeDirectories();
    }

    private void initializeDirectories() {
        try {
            Files.createDirectories(recordingsRoot);
            Files.createDirectories(tempRoot);
            Files.createDirectories(recordingsRoot.resolve(THUMBNAILS_DIR));
            logger.info("Local storage directories initialized: recordings={}, temp={}", recordingsRoot, tempRoot);
        } catch (IOException e) {
            throw new StorageConfigurationException(
                    "Failed to initialize local storage directories under " + recordingsRoot, e);
        }
    }

    @Override
    public StorageResult save(Path tempFile, String streamKey, RecordingDetails details) {
        if (!StreamKeys.isSafeComponent(streamKey)) {
            logger.warn("Refusing to save recording for unusable stream key: {}", streamKey);
            return StorageResult.failure(streamKey, "InvalidStreamKey: " + streamKey);
        }
        if (tempFile == null || !Files.exists(tempFile)) {
            logger.error("Failed to save recording locally: temp file not found: {}", tempFile);
            return StorageResult.failure(streamKey, "TempFileNotFound: " + tempFile);
        }

        Instant now = clock.instant();
        String fileName;
        Path finalPath;
        // The name is claimed with an exclusive create before the rename replaces the placeholder,
        // so concurrent saves for one key in the same millisecond never share a target
        while (true) {
            fileName = RecordingFileNames.fileName(streamKey, now, extension);
            finalPath = recordingsRoot.resolve(fileName);
            try {
                Files.createFile(finalPath);
                break;
            } catch (FileAlreadyExistsException e) {
                now = now.plusMillis(1);
            } catch (IOException e) {
                logger.error("Failed to save recording locally: {}", fileName, e);
                return StorageResult.failure(streamKey, "MoveFailed: " + e.getMessage());
            }
        }

        boolean moved = false;
        try {
            moveIntoPlace(tempFile, finalPath);
            moved = true;
            long size = Files.size(finalPath);

            StorageMetadata metadata = StorageMetadata.builder()
                    .streamKey(streamKey)
                    .fileName(fileName)
                    .fileSize(size)
                    .uploadTime(now)
                    .build();
            if (details != null) {
                metadata = details.applyTo(metadata);
                Path thumbnail = adoptThumbnail(details.getThumbnailPath(), fileName);
                metadata = metadata.toBuilder()
                        .thumbnailPath(thumbnail == null ? null : thumbnail.toString())
                        .build();
            }

            logger.info("Recording saved locally: {} ({} bytes)", fileName, size);
            return StorageResult.builder()
                    .success(true)
                    .filePath(finalPath.toString())
                    .url(publicBaseUrl + "/" + fileName)
                    .metadata(metadata)
                    .build();
        } catch (NoSuchFileException e) {
            // Removed by an external cleanup between the existence check and the move
            logger.error("Failed to save recording locally: temp file vanished: {}", tempFile);
            if (!moved) {
                releasePlaceholder(finalPath);
            }
            return StorageResult.failure(streamKey, "TempFileNotFound: " + tempFile);
        } catch (IOException e) {
            logger.error("Failed to save recording locally: {}", fileName, e);
            if (!moved) {
                releasePlaceholder(finalPath);
            }
            return StorageResult.failure(streamKey, "MoveFailed: " + e.getMessage());
        }
    }

    private void releasePlaceholder(Path finalPath) {
        try {
            Files.deleteIfExists(finalPath);
        } catch (IOException e) {
            logger.warn("Failed to remove placeholder {}: {}", finalPath, e.getMessage());
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Path part = target.resolveSibling("." + target.getFileName() + PART_SUFFIX);
            logger.debug("Atomic move not supported from {}, staging through {}", source, part);
            try {
                Files.copy(source, part, StandardCopyOption.REPLACE_EXISTING);
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(part);
            }
            Files.delete(source);
        }
    }

    /**
     * Moves a thumbnail produced next to the capture into the thumbnails directory, named after the
     * recording. Best effort: a missing or unmovable thumbnail leaves the recording without one.
     */
    private Path adoptThumbnail(String thumbnailPath, String fileName) {
        if (thumbnailPath == null) {
            return null;
        }
        Path source = Paths.get(thumbnailPath);
        if (!Files.isRegularFile(source)) {
            return null;
        }
        Path target = getThumbnailsDirectory().resolve(RecordingFileNames.baseName(fileName) + ".jpg");
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            logger.warn("Failed to store thumbnail for {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    @Override
    public String resolveUrl(String fileName) {
        return resolveUrl(fileName, 0L);
    }

    /**
     * Local recordings are served publicly; the expiry is ignored.
     */
    @Override
    public String resolveUrl(String fileName, long expirySeconds) {
        if (!StreamKeys.isSafeComponent(fileName) || !Files.isRegularFile(recordingsRoot.resolve(fileName))) {
            throw new RecordingNotFoundException(fileName);
        }
        return publicBaseUrl + "/" + fileName;
    }

    @Override
    public boolean delete(String fileName) {
        if (!StreamKeys.isSafeComponent(fileName)) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(recordingsRoot.resolve(fileName));
            if (deleted) {
                deleteThumbnail(fileName);
                logger.info("Recording deleted: {}", fileName);
            }
            return deleted;
        } catch (IOException e) {
            logger.error("Failed to delete recording {}: {}", fileName, e.getMessage());
            return false;
        }
    }

    @Override
    public List<StorageMetadata> list(String streamKeyFilter) {
        String prefix = (streamKeyFilter == null || streamKeyFilter.isEmpty())
                ? null
                : streamKeyFilter + RecordingFileNames.SEPARATOR;

        try (Stream<Path> files = Files.list(recordingsRoot)) {
            List<StorageMetadata> recordings = new ArrayList<>();
            for (Path file : files.collect(Collectors.toList())) {
                String name = file.getFileName().toString();
                if (!isRecording(name) || (prefix != null && !name.startsWith(prefix))) {
                    continue;
                }
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(file, BasicFileAttributes.class);
                } catch (IOException e) {
                    // Deleted or cleaned up after the directory was read
                    logger.warn("Skipping unreadable recording {}: {}", name, e.getMessage());
                    continue;
                }
                recordings.add(StorageMetadata.builder()
                        .streamKey(RecordingFileNames.streamKeyOf(name))
                        .fileName(name)
                        .fileSize(attrs.size())
                        .uploadTime(recordedAt(attrs))
                        .build());
            }
            recordings.sort(Comparator.comparing(StorageMetadata::getUploadTime).reversed());
            return recordings;
        } catch (IOException e) {
            logger.error("Failed to list recordings: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    @Override
    public StorageUsage usage() {
        try (Stream<Path> files = Files.list(recordingsRoot)) {
            long used = 0L;
            for (Path file : files.collect(Collectors.toList())) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    used += Files.size(file);
                } catch (IOException e) {
                    logger.warn("Skipping {} in usage: {}", file.getFileName(), e.getMessage());
                }
            }
            return new StorageUsage(used, capacityBytes);
        } catch (IOException e) {
            logger.error("Failed to get storage info: {}", e.getMessage(), e);
            return StorageUsage.ZERO;
        }
    }

    /**
     * Deletes every recording older than {@code maxAgeHours}. A file that cannot be inspected or
     * deleted is logged and skipped; the sweep continues.
     *
     * @return number of recordings deleted
     */
    public int cleanupOldRecordings(int maxAgeHours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        List<Path> files;
        try (Stream<Path> stream = Files.list(recordingsRoot)) {
            files = stream.collect(Collectors.toList());
        } catch (IOException e) {
            logger.error("Failed to cleanup old recordings: {}", e.getMessage(), e);
            return 0;
        }

        int deletedCount = 0;
        for (Path file : files) {
            try {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                if (recordedAt(attrs).isBefore(cutoff)) {
                    Files.delete(file);
                    deletedCount++;
                    deleteThumbnail(file.getFileName().toString());
                    logger.info("Cleaned up old recording: {}", file.getFileName());
                }
            } catch (IOException e) {
                logger.warn("Could not clean up {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return deletedCount;
    }

    public Path getRecordingsRoot() {
        return recordingsRoot;
    }

    public Path getThumbnailsDirectory() {
        return recordingsRoot.resolve(THUMBNAILS_DIR);
    }

    private boolean isRecording(String name) {
        return name.endsWith("." + extension) && !name.startsWith(".");
    }

    private void deleteThumbnail(String fileName) {
        Path thumbnail = getThumbnailsDirectory().resolve(RecordingFileNames.baseName(fileName) + ".jpg");
        try {
            Files.deleteIfExists(thumbnail);
        } catch (IOException e) {
            logger.warn("Failed to delete thumbnail {}: {}", thumbnail, e.getMessage());
        }
    }

    /**
     * Earlier of creation and last-modified time. A rename keeps the capture's modification time,
     * and several filesystems do not report a birth time at all.
     */
    private static Instant recordedAt(BasicFileAttributes attrs) {
        Instant created = attrs.creationTime().toInstant();
        Instant modified = attrs.lastModifiedTime().toInstant();
        return created.isBefore(modified) ? created : modified;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
