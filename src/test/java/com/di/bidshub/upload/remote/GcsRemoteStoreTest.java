package com.di.bidshub.upload.remote;

import com.di.bidshub.exception.TransferException;
import com.di.bidshub.upload.assemble.SerializedShard;
import com.di.bidshub.upload.config.GcsProperties;
import com.di.bidshub.util.Checksums;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GcsRemoteStore Tests")
class GcsRemoteStoreTest {

    @Mock
    private Storage storage;

    @TempDir
    Path spoolDir;

    private GcsProperties  properties;
    private GcsRemoteStore store;

    private static final String FP   = "a1b2c3d4e5f60718293a4b5c6d7e8f90";
    private static final String PLAN = "bids-hub/ds/plans/a1b2c3d4e5f60718";

    @BeforeEach
    void setUp() {
        properties = new GcsProperties();
        properties.setBucket("imaging");
        properties.setPrefix("/bids-hub/");
        store = new GcsRemoteStore(storage, properties);
    }

    private SerializedShard shard(int index) throws IOException {
        byte[] bytes = ("shard-" + index).getBytes(StandardCharsets.UTF_8);
        Path file = Files.write(spoolDir.resolve("shard-" + index + ".json.gz"), bytes);
        return new SerializedShard(index, file, bytes.length, Checksums.crc32cBase64(bytes), 1);
    }

    private static Blob entryBlob(int shardIndex, String revision) {
        Blob blob = mock(Blob.class);
        when(blob.getContent()).thenReturn(("{\"shardIndex\":" + shardIndex + ",\"revision\":\"" + revision + "\"}")
                .getBytes(StandardCharsets.UTF_8));
        return blob;
    }

    @Test
    @DisplayName("Should stream the spool file to a plan-scoped object name")
    void testBeginShardTransfer_ObjectName() throws Exception {
        SerializedShard shard = shard(7);

        TransferHandle handle = store.beginShardTransfer("ds004884", FP, shard);

        ArgumentCaptor<BlobInfo> info = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).createFrom(info.capture(), eq(shard.file()));
        assertEquals("imaging", info.getValue().getBucket());
        assertEquals("bids-hub/ds004884/plans/a1b2c3d4e5f60718/data/shard-00007.json.gz", info.getValue().getName());
        assertEquals(info.getValue().getName(), handle.objectName());
        assertEquals(7, handle.shardIndex());
    }

    @Test
    @DisplayName("Should keep shards of different plans under different names")
    void testBeginShardTransfer_PlansDoNotCollide() throws Exception {
        SerializedShard shard = shard(0);

        String first  = store.beginShardTransfer("ds", FP, shard).objectName();
        String second = store.beginShardTransfer("ds", "ffff0000ffff0000aaaa", shard).objectName();

        assertNotEquals(first, second);
        assertEquals("bids-hub/ds/plans/ffff0000ffff0000/data/shard-00000.json.gz", second);
    }

    @Test
    @DisplayName("Should treat an unreadable spool file as a permanent transfer failure")
    void testBeginShardTransfer_SpoolUnreadable() throws Exception {
        SerializedShard shard = shard(0);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class)))
                .thenThrow(new NoSuchFileException(shard.file().toString()));

        TransferException e = assertThrows(TransferException.class, () -> store.beginShardTransfer("ds", FP, shard));
        assertInstanceOf(NoSuchFileException.class, e.getCause());
    }

    @Test
    @DisplayName("Should report size, CRC32C and generation on confirmation")
    void testConfirmTransfer_Receipt() {
        Blob blob = mock(Blob.class);
        when(blob.getSize()).thenReturn(7L);
        when(blob.getCrc32c()).thenReturn("abcd==");
        when(blob.getGeneration()).thenReturn(1700000000123L);
        when(storage.get(any(BlobId.class))).thenReturn(blob);

        TransferReceipt receipt = store.confirmTransfer(new TransferHandle("ds", 0, "bids-hub/ds/data/shard-00000.json.gz"));

        assertEquals(7L, receipt.committedSize());
        assertEquals("abcd==", receipt.checksum());
        assertEquals("1700000000123", receipt.revision());
    }

    @Test
    @DisplayName("Should treat a missing object after upload as retryable")
    void testConfirmTransfer_Missing() {
        when(storage.get(any(BlobId.class))).thenReturn(null);

        TransferException e = assertThrows(TransferException.class,
                () -> store.confirmTransfer(new TransferHandle("ds", 0, "x")));
        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("Should mark 5xx and 429 storage errors retryable")
    void testTranslate_Retryable() throws Exception {
        SerializedShard shard = shard(0);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class)))
                .thenThrow(new StorageException(503, "backend unavailable"))
                .thenThrow(new StorageException(429, "rate limit exceeded"));

        assertTrue(assertThrows(TransferException.class, () -> store.beginShardTransfer("ds", FP, shard)).isRetryable());
        assertTrue(assertThrows(TransferException.class, () -> store.beginShardTransfer("ds", FP, shard)).isRetryable());
    }

    @Test
    @DisplayName("Should mark permission errors permanent")
    void testTranslate_Permanent() throws Exception {
        SerializedShard shard = shard(0);
        when(storage.createFrom(any(BlobInfo.class), any(Path.class)))
                .thenThrow(new StorageException(403, "forbidden"));

        TransferException e = assertThrows(TransferException.class, () -> store.beginShardTransfer("ds", FP, shard));
        assertFalse(e.isRetryable());
        assertInstanceOf(StorageException.class, e.getCause());
    }

    @Test
    @DisplayName("Should write one manifest entry object per committed shard")
    @SuppressWarnings("unchecked")
    void testAppendManifestEntry() throws Exception {
        store.appendManifestEntry("ds", FP, 3, "42");

        ArgumentCaptor<BlobInfo> info  = ArgumentCaptor.forClass(BlobInfo.class);
        ArgumentCaptor<byte[]>   bytes = ArgumentCaptor.forClass(byte[].class);
        verify(storage).create(info.capture(), bytes.capture());
        assertEquals(PLAN + "/entries/shard-00003.json", info.getValue().getName());

        Map<String, Object> entry = new ObjectMapper().readValue(bytes.getValue(), Map.class);
        assertEquals(3, entry.get("shardIndex"));
        assertEquals("42", entry.get("revision"));
        assertEquals(FP, entry.get("planFingerprint"));
        assertEquals(PLAN + "/data/shard-00003.json.gz", entry.get("path"));
    }

    @Test
    @DisplayName("Should publish only the plan's shards in index order")
    @SuppressWarnings("unchecked")
    void testFinalizeManifest() throws Exception {
        Blob second = entryBlob(1, "11");
        Blob first  = entryBlob(0, "10");
        Blob stale  = entryBlob(2, "12");
        Page<Blob> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(second, stale, first));
        when(storage.list(eq("imaging"), any(Storage.BlobListOption.class))).thenReturn(page);

        store.finalizeManifest("ds", FP, 2);

        ArgumentCaptor<BlobInfo> info  = ArgumentCaptor.forClass(BlobInfo.class);
        ArgumentCaptor<byte[]>   bytes = ArgumentCaptor.forClass(byte[].class);
        verify(storage).create(info.capture(), bytes.capture());
        assertEquals("bids-hub/ds/manifest.json", info.getValue().getName());

        Map<String, Object> manifest = new ObjectMapper().readValue(bytes.getValue(), Map.class);
        assertEquals(2, manifest.get("shardCount"));
        assertEquals(FP, manifest.get("planFingerprint"));
        List<Map<String, Object>> shards = (List<Map<String, Object>>) manifest.get("shards");
        assertEquals(2, shards.size());
        assertEquals(0, shards.get(0).get("shardIndex"));
        assertEquals(1, shards.get(1).get("shardIndex"));
    }

    @Test
    @DisplayName("Should refuse to publish when a planned shard has no entry")
    @SuppressWarnings("unchecked")
    void testFinalizeManifest_MissingEntry() {
        Blob first = entryBlob(0, "10");
        Page<Blob> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(first));
        when(storage.list(eq("imaging"), any(Storage.BlobListOption.class))).thenReturn(page);

        TransferException e = assertThrows(TransferException.class, () -> store.finalizeManifest("ds", FP, 3));

        assertFalse(e.isRetryable());
        assertTrue(e.getMessage().contains("[1, 2]"));
        verify(storage, never()).create(any(BlobInfo.class), any(byte[].class));
    }

    @Test
    @DisplayName("Should refuse to run without a configured bucket")
    void testBucket_NotConfigured() throws Exception {
        properties.setBucket(" ");
        SerializedShard shard = shard(0);

        assertThrows(IllegalStateException.class, () -> store.beginShardTransfer("ds", FP, shard));
        verifyNoInteractions(storage);
    }
}
