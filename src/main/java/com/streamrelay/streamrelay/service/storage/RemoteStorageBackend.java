package com.streamrelay.streamrelay.service.storage;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageClass;
import com.google.cloud.storage.StorageException;
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
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Stores recordings in a Google Cloud Storage bucket under
 * {@code <prefix><streamKey>/<streamKey>_<timestamp>.<ext>}.
 *
 * <p>When a CDN domain is configured every URL handed out is the public CDN URL; otherwise URLs are
 * V4 signed URLs with a bounded lifetime. The two are never mixed.
 *
 * <p>No timeout wraps an upload; the client's own connection and retry settings are the only
 * guard against a hung call.
 */
public class RemoteStorageBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(RemoteStorageBackend.class);
    private static final int PAGE_SIZE = 1000;
    private static final String UNKNOWN_STREAM_KEY = "unknown";

    private final Storage storage;
    private final String bucketName;
    private final String prefix;
    private final String cdnDomain;
    private final long defaultExpirySeconds;
    private final StorageClass storageClass;
    private final String kmsKeyName;
    private final String extension;
    private final String contentType;
    private final Clock clock;

    /**
     * @throws StorageConfigurationException if the bucket is missing or unreachable with the
     *         configured credentials
     */
    public RemoteStorageBackend(Storage storage, StorageProperties properties) {
        this(storage, properties, Clock.systemUTC());
    }

    public RemoteStorageBackend(Storage storage, StorageProperties properties, Clock clock) {
        StorageProperties.Remote remote = properties.getRemote();
        this.storage = storage;
        this.bucketName = remote.getBucket();
        this.prefix = remote.normalizedPrefix();
        this.cdnDomain = remote.hasCdnDomain() ? stripScheme(remote.getCdnDomain().trim()) : null;
        this.defaultExpirySeconds = remote.getSignedUrlExpirySeconds();
        this.storageClass = StorageClass.valueOf(remote.getStorageClass().trim().toUpperCase());
        this.kmsKeyName = (remote.getKmsKeyName() == null || remote.getKmsKeyName().isBlank())
                ? null
                : remote.getKmsKeyName().trim();
        this.extension = properties.getFileExtension();
        this.contentType = properties.getContentType();
        this.clock = clock;
        verifyConnection();
    }

    private void verifyConnection() {
        Bucket bucket;
        try {
            bucket = storage.get(bucketName, Storage.BucketGetOption.fields(Storage.BucketField.NAME));
        } catch (StorageException e) {
            logger.error("Cloud Storage connection failed: {}", e.getMessage(), e);
            throw new StorageConfigurationException("Cloud Storage connection failed: " + e.getMessage(), e);
        }
        if (bucket == null) {
            throw new StorageConfigurationException("Cloud Storage bucket does not exist: " + bucketName);
        }
        logger.info("Cloud Storage connection verified: {}", bucketName);
    }

    @Override
    public StorageResult save(Path tempFile, String streamKey, RecordingDetails details) {
        if (!StreamKeys.isSafeComponent(streamKey)) {
            logger.warn("Refusing to upload recording for unusable stream key: {}", streamKey);
            return StorageResult.failure(streamKey, "InvalidStreamKey: " + streamKey);
        }
        if (tempFile == null || !Files.exists(tempFile)) {
            logger.error("Failed to upload recording: temp file not found: {}", tempFile);
            return StorageResult.failure(streamKey, "TempFileNotFound: " + tempFile);
        }

        RecordingDetails extra = details == null ? RecordingDetails.NONE : details;
        Instant now = clock.instant();
        String fileName = RecordingFileNames.fileName(streamKey, now, extension);
        String objectKey = prefix + streamKey + "/" + fileName;

        try {
            long size = Files.size(tempFile);

            Map<String, String> objectMetadata = new LinkedHashMap<>();
            objectMetadata.put("streamKey", streamKey);
            objectMetadata.put("originalFileName", fileName);
            objectMetadata.put("uploadTime", now.toString());
            objectMetadata.put("fileSize", Long.toString(size));
            objectMetadata.putAll(extra.asAttributes());
            objectMetadata.remove("thumbnailPath");

            String thumbnailKey = uploadThumbnail(extra.getThumbnailPath(), streamKey, fileName);
            if (thumbnailKey != null) {
                objectMetadata.put("thumbnailPath", thumbnailKey);
            }

            BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucketName, objectKey))
                    .setContentType(contentType)
                    .setStorageClass(storageClass)
                    .setMetadata(objectMetadata)
                    .build();

            Blob blob = storage.createFrom(blobInfo, tempFile, writeOptions());
            long persistedSize = blob != null && blob.getSize() != null ? blob.getSize() : size;

            // Only after the store acknowledged the write
            deleteTempFile(tempFile, objectKey);

            StorageMetadata metadata = extra.applyTo(StorageMetadata.builder()
                    .streamKey(streamKey)
                    .fileName(fileName)
                    .fileSize(persistedSize)
                    .uploadTime(now)
                    .build())
                    .toBuilder()
                    .thumbnailPath(thumbnailKey)
                    .build();

            logger.info("Recording uploaded to Cloud Storage: {}", objectKey);
            return StorageResult.builder()
                    .success(true)
                    .filePath(objectKey)
                    .url(urlAfterUpload(objectKey))
                    .metadata(metadata)
                    .build();
        } catch (NoSuchFileException e) {
            // Removed by an external cleanup between the existence check and the upload
            logger.error("Failed to upload recording: temp file vanished: {}", tempFile);
            return StorageResult.failure(streamKey, "TempFileNotFound: " + tempFile);
        } catch (IOException | StorageException e) {
            logger.error("Failed to upload recording to Cloud Storage: {}", objectKey, e);
            return StorageResult.failure(streamKey, "UploadFailed: " + e.getMessage());
        }
    }

    /**
     * The object already exists at this point, so a leftover capture is only logged. Reporting a
     * failure would make the caller upload it a second time.
     */
    private void deleteTempFile(Path tempFile, String objectKey) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Uploaded {} but could not remove temp file {}: {}", objectKey, tempFile, e.getMessage());
        }
    }

    private Storage.BlobWriteOption[] writeOptions() {
        if (kmsKeyName == null) {
            // Objects are encrypted server-side with store-managed keys
            return new Storage.BlobWriteOption[0];
        }
        return new Storage.BlobWriteOption[] {Storage.BlobWriteOption.kmsKeyName(kmsKeyName)};
    }

    private String uploadThumbnail(String thumbnailPath, String streamKey, String fileName) {
        if (thumbnailPath == null) {
            return null;
        }
        Path source = Paths.get(thumbnailPath);
        if (!Files.isRegularFile(source)) {
            return null;
        }
        String key = prefix + streamKey + "/" + LocalStorageBackend.THUMBNAILS_DIR + "/"
                + RecordingFileNames.baseName(fileName) + ".jpg";
        try {
            BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucketName, key))
                    .setContentType("image/jpeg")
                    .build();
            storage.createFrom(info, source, writeOptions());
            Files.deleteIfExists(source);
            return key;
        } catch (IOException | StorageException e) {
            logger.warn("Failed to upload thumbnail for {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    private String urlAfterUpload(String objectKey) {
        if (cdnDomain != null) {
            return cdnUrl(objectKey);
        }
        try {
            return signedUrl(objectKey, defaultExpirySeconds);
        } catch (RuntimeException e) {
            logger.warn("Uploaded {} but could not sign a URL for it: {}", objectKey, e.getMessage());
            return null;
        }
    }

    @Override
    public String resolveUrl(String objectKey) {
        return resolveUrl(objectKey, defaultExpirySeconds);
    }

    @Override
    public String resolveUrl(String objectKey, long expirySeconds) {
        if (cdnDomain != null) {
            return cdnUrl(objectKey);
        }
        Blob blob;
        try {
            blob = storage.get(BlobId.of(bucketName, objectKey));
        } catch (StorageException e) {
            logger.error("Failed to get recording URL: {}", objectKey, e);
            throw e;
        }
        if (blob == null) {
            throw new RecordingNotFoundException(objectKey);
        }
        return signedUrl(objectKey, expirySeconds > 0 ? expirySeconds : defaultExpirySeconds);
    }

    private String signedUrl(String objectKey, long expirySeconds) {
        URL url = storage.signUrl(
                BlobInfo.newBuilder(BlobId.of(bucketName, objectKey)).build(),
                expirySeconds,
                TimeUnit.SECONDS,
                Storage.SignUrlOption.withV4Signature());
        return url.toString();
    }

    private String cdnUrl(String objectKey) {
        return "https://" + cdnDomain + "/" + objectKey;
    }

    @Override
    public boolean delete(String objectKey) {
        try {
            boolean deleted = storage.delete(BlobId.of(bucketName, objectKey));
            if (deleted) {
                logger.info("Recording deleted from Cloud Storage: {}", objectKey);
            } else {
                logger.debug("Recording already absent from Cloud Storage: {}", objectKey);
            }
            return deleted;
        } catch (StorageException e) {
            logger.error("Failed to delete recording from Cloud Storage: {}", objectKey, e);
            return false;
        }
    }

    @Override
    public List<StorageMetadata> list(String streamKeyFilter) {
        String listPrefix = (streamKeyFilter == null || streamKeyFilter.isEmpty())
                ? prefix
                : prefix + streamKeyFilter + "/";
        try {
            List<StorageMetadata> recordings = new ArrayList<>();
            for (Blob blob : listAll(listPrefix)) {
                String name = blob.getName();
                if (name == null || !name.endsWith("." + extension)) {
                    continue;
                }
                recordings.add(toMetadata(blob));
            }
            recordings.sort(Comparator.comparing(StorageMetadata::getUploadTime).reversed());
            return recordings;
        } catch (StorageException e) {
            logger.error("Failed to list recordings from Cloud Storage", e);
            return new ArrayList<>();
        }
    }

    private StorageMetadata toMetadata(Blob blob) {
        Map<String, String> meta = blob.getMetadata() == null ? Map.of() : blob.getMetadata();
        String name = blob.getName();
        Long created = blob.getCreateTime();
        return StorageMetadata.builder()
                .streamKey(meta.getOrDefault("streamKey", UNKNOWN_STREAM_KEY))
                .fileName(name.substring(name.lastIndexOf('/') + 1))
                .fileSize(blob.getSize() == null ? 0L : blob.getSize())
                .uploadTime(created == null ? clock.instant() : Instant.ofEpochMilli(created))
                .quality(meta.get("quality"))
                .duration(parseDuration(meta.get("duration")))
                .thumbnailPath(meta.get("thumbnailPath"))
                .build();
    }

    private static Double parseDuration(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Cloud Storage has no practical capacity limit, so {@code available} is {@link Long#MAX_VALUE}.
     */
    @Override
    public StorageUsage usage() {
        try {
            long used = 0L;
            for (Blob blob : listAll(prefix)) {
                if (blob.getSize() != null) {
                    used += blob.getSize();
                }
            }
            return new StorageUsage(used, Long.MAX_VALUE);
        } catch (StorageException e) {
            logger.error("Failed to get Cloud Storage usage", e);
            return StorageUsage.ZERO;
        }
    }

    /**
     * Lists every object under {@code listPrefix}, following continuation tokens until the store
     * reports no further page.
     */
    private List<Blob> listAll(String listPrefix) {
        List<Blob> blobs = new ArrayList<>();
        String pageToken = null;
        do {
            Page<Blob> page = pageToken == null
                    ? storage.list(bucketName,
                            Storage.BlobListOption.prefix(listPrefix),
                            Storage.BlobListOption.pageSize(PAGE_SIZE))
                    : storage.list(bucketName,
                            Storage.BlobListOption.prefix(listPrefix),
                            Storage.BlobListOption.pageSize(PAGE_SIZE),
                            Storage.BlobListOption.pageToken(pageToken));
            for (Blob blob : page.getValues()) {
                blobs.add(blob);
            }
            pageToken = page.getNextPageToken();
        } while (pageToken != null && !pageToken.isEmpty());
        return blobs;
    }

    private static String stripScheme(String domain) {
        String d = domain;
        if (d.startsWith("https://")) {
            d = d.substring("https://".length());
        } else if (d.startsWith("http://")) {
            d = d.substring("http://".length());
        }
        return d.endsWith("/") ? d.substring(0, d.length() - 1) : d;
    }
}
