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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RemoteStorageBackendTest {

    private static final String BUCKET = "recordings-bucket";
    private static final Instant NOW = Instant.parse("2024-05-01T12:30:45.123Z");
    private static final String OBJECT_KEY = "recordings/abc123/abc123_2024-05-01T12-30-45-123Z.flv";

    @TempDir
    Path tempDir;

    private Storage storage;
    private StorageProperties properties;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        when(storage.get(eq(BUCKET), any(Storage.BucketGetOption.class))).thenReturn(mock(Bucket.class));

        properties = new StorageProperties();
        properties.getRemote().setBucket(BUCKET);
        properties.getRemote().setPrefix("recordings");
    }

    private RemoteStorageBackend backend() {
        return new RemoteStorageBackend(storage, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testConstructor_MissingBucket_FailsFast() {
        when(storage.get(eq(BUCKET), any(Storage.BucketGetOption.class))).thenReturn(null);

        assertThrows(StorageConfigurationException.class, this::backend);
    }

    @Test
    void testConstructor_UnreachableStore_FailsFast() {
        when(storage.get(eq(BUCKET), any(Storage.BucketGetOption.class)))
                .thenThrow(new StorageException(403, "forbidden"));

        assertThrows(StorageConfigurationException.class, this::backend);
    }

    @Test
    void testSave_UploadsWithMetadataThenDeletesTempFile() throws Exception {
        Path capture = Files.write(tempDir.resolve("abc123.flv"), new byte[2048]);
        Blob uploaded = mock(Blob.class);
        when(uploaded.getSize()).thenReturn(2048L);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class), any(Storage.BlobWriteOption[].class)))
                .thenReturn(uploaded);
        when(storage.signUrl(any(BlobInfo.class), anyLong(), any(TimeUnit.class), any(Storage.SignUrlOption[].class)))
                .thenReturn(new URL("https://signed.test/object"));

        StorageResult result = backend().save(capture, "abc123",
                RecordingDetails.builder().duration(30.0).quality("1080p").build());

        assertTrue(result.isSuccess());
        assertEquals(OBJECT_KEY, result.getFilePath());
        assertEquals("https://signed.test/object", result.getUrl());
        assertEquals(2048L, result.getMetadata().getFileSize());
        assertFalse(Files.exists(capture));

        ArgumentCaptor<BlobInfo> info = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).createFrom(info.capture(), eq(capture), any(Storage.BlobWriteOption[].class));
        assertEquals(OBJECT_KEY, info.getValue().getName());
        assertEquals(StorageClass.NEARLINE, info.getValue().getStorageClass());
        assertEquals("video/x-flv", info.getValue().getContentType());
        Map<String, String> metadata = info.getValue().getMetadata();
        assertEquals("abc123", metadata.get("streamKey"));
        assertEquals("abc123_2024-05-01T12-30-45-123Z.flv", metadata.get("originalFileName"));
        assertEquals("2048", metadata.get("fileSize"));
        assertEquals("30.0", metadata.get("duration"));
        assertEquals("1080p", metadata.get("quality"));
    }

    @Test
    void testSave_UploadFailure_KeepsTempFile() throws Exception {
        Path capture = Files.write(tempDir.resolve("abc123.flv"), new byte[16]);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class), any(Storage.BlobWriteOption[].class)))
                .thenThrow(new IOException("connection reset"));

        StorageResult result = backend().save(capture, "abc123", null);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("UploadFailed"));
        assertTrue(Files.exists(capture));
    }

    @Test
    void testSave_MissingTempFile_UploadsNothing() throws Exception {
        StorageResult result = backend().save(tempDir.resolve("gone.flv"), "abc123", null);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("TempFileNotFound"));
        verify(storage, never()).createFrom(any(BlobInfo.class), any(Path.class), any(Storage.BlobWriteOption[].class));
    }

    @Test
    void testSave_TempFileVanishesDuringUpload_ReportsTempFileNotFound() throws Exception {
        Path capture = Files.write(tempDir.resolve("abc123.flv"), new byte[16]);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class), any(Storage.BlobWriteOption[].class)))
                .thenAnswer(invocation -> {
                    Files.delete(capture);
                    throw new NoSuchFileException(capture.toString());
                });

        StorageResult result = backend().save(capture, "abc123", null);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("TempFileNotFound"), result.getError());
        assertEquals("abc123", result.getMetadata().getStreamKey());
    }

    @Test
    void testSave_TempFileNotRemovable_StillReportsUploadedObject() throws Exception {
        // A non-empty directory cannot be deleted, standing in for a capture that refuses removal
        Path capture = Files.createDirectory(tempDir.resolve("abc123.flv"));
        Files.write(capture.resolve("segment"), new byte[8]);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class), any(Storage.BlobWriteOption[].class)))
                .thenReturn(mock(Blob.class));
        when(storage.signUrl(any(BlobInfo.class), anyLong(), any(TimeUnit.class), any(Storage.SignUrlOption[].class)))
                .thenReturn(new URL("https://signed.test/object"));

        StorageResult result = backend().save(capture, "abc123", null);

        assertTrue(result.isSuccess());
        assertEquals(OBJECT_KEY, result.getFilePath());
        assertTrue(Files.exists(capture));
    }

    @Test
    void testSave_WithCdn_ReturnsCdnUrlAndNeverSigns() throws Exception {
        properties.getRemote().setCdnDomain("https://cdn.example.com/");
        Path capture = Files.write(tempDir.resolve("abc123.flv"), new byte[8]);

        StorageResult result = backend().save(capture, "abc123", null);

        assertEquals("https://cdn.example.com/" + OBJECT_KEY, result.getUrl());
        verify(storage, never()).signUrl(any(BlobInfo.class), anyLong(), any(TimeUnit.class),
                any(Storage.SignUrlOption[].class));
    }

    @Test
    void testResolveUrl_SignsWithRequestedExpiry() throws Exception {
        when(storage.get(any(BlobId.class))).thenReturn(mock(Blob.class));
        when(storage.signUrl(any(BlobInfo.class), anyLong(), any(TimeUnit.class), any(Storage.SignUrlOption[].class)))
                .thenReturn(new URL("https://signed.test/object"));

        String url = backend().resolveUrl(OBJECT_KEY, 120);

        assertEquals("https://signed.test/object", url);
        verify(storage).signUrl(any(BlobInfo.class), eq(120L), eq(TimeUnit.SECONDS), any(Storage.SignUrlOption[].class));
    }

    @Test
    void testResolveUrl_MissingObject_Throws() {
        when(storage.get(any(BlobId.class))).thenReturn(null);

        assertThrows(RecordingNotFoundException.class, () -> backend().resolveUrl(OBJECT_KEY));
    }

    @Test
    void testResolveUrl_WithCdn_IgnoresExpiry() {
        properties.getRemote().setCdnDomain("cdn.example.com");

        assertEquals("https://cdn.example.com/" + OBJECT_KEY, backend().resolveUrl(OBJECT_KEY, 5));
        verify(storage, never()).get(any(BlobId.class));
    }

    @Test
    void testDelete_AbsentObjectReturnsFalse() {
        when(storage.delete(any(BlobId.class))).thenReturn(true, false);
        RemoteStorageBackend backend = backend();

        assertTrue(backend.delete(OBJECT_KEY));
        assertFalse(backend.delete(OBJECT_KEY));
    }

    @Test
    void testUsage_FollowsEveryPage() {
        Page<Blob> first = page("token-2", blob("recordings/a/a_1.flv", 100L, null, null));
        Page<Blob> second = page(null, blob("recordings/b/b_1.flv", 50L, null, null),
                blob("recordings/b/thumbnails/b_1.jpg", 5L, null, null));
        when(storage.list(eq(BUCKET), any(Storage.BlobListOption[].class))).thenReturn(first, second);

        StorageUsage usage = backend().usage();

        assertEquals(155L, usage.getUsed());
        verify(storage, times(2)).list(eq(BUCKET), any(Storage.BlobListOption[].class));
    }

    @Test
    void testUsage_StoreFailure_ReturnsZero() {
        when(storage.list(eq(BUCKET), any(Storage.BlobListOption[].class)))
                .thenThrow(new StorageException(500, "backend error"));

        assertEquals(StorageUsage.ZERO, backend().usage());
    }

    @Test
    void testList_ReadsObjectMetadataNewestFirst() {
        Page<Blob> only = page(null,
                blob("recordings/abc123/abc123_1.flv", 10L, Map.of("streamKey", "abc123", "quality", "720p"), 1_000L),
                blob("recordings/abc123/abc123_2.flv", 20L, Map.of("duration", "12.5"), 2_000L),
                blob("recordings/abc123/thumbnails/abc123_2.jpg", 1L, null, 3_000L));
        when(storage.list(eq(BUCKET), any(Storage.BlobListOption[].class))).thenReturn(only);

        List<StorageMetadata> listed = backend().list("abc123");

        assertEquals(2, listed.size());
        assertEquals("abc123_2.flv", listed.get(0).getFileName());
        assertEquals("unknown", listed.get(0).getStreamKey());
        assertEquals(12.5, listed.get(0).getDuration());
        assertEquals("abc123", listed.get(1).getStreamKey());
        assertEquals("720p", listed.get(1).getQuality());
    }

    @Test
    void testList_StoreFailure_ReturnsEmpty() {
        when(storage.list(eq(BUCKET), any(Storage.BlobListOption[].class)))
                .thenThrow(new StorageException(500, "backend error"));

        assertTrue(backend().list(null).isEmpty());
    }

    @SuppressWarnings("unchecked")
    private static Page<Blob> page(String nextToken, Blob... blobs) {
        Page<Blob> page = mock(Page.class);
        when(page.getValues()).thenReturn(List.of(blobs));
        when(page.getNextPageToken()).thenReturn(nextToken);
        return page;
    }

    private static Blob blob(String name, Long size, Map<String, String> metadata, Long createTime) {
        Blob blob = mock(Blob.class);
        when(blob.getName()).thenReturn(name);
        when(blob.getSize()).thenReturn(size);
        when(blob.getMetadata()).thenReturn(metadata);
        when(blob.getCreateTime()).thenReturn(createTime);
        return blob;
    }
}
