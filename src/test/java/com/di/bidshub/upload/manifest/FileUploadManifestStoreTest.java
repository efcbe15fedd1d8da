package com.di.bidshub.upload.manifest;

import com.di.bidshub.exception.ManifestCorruptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileUploadManifestStore Tests")
class FileUploadManifestStoreTest {

    @TempDir
    Path stateDir;

    private UploadManifest manifest(String datasetId) {
        List<UploadManifest.Entry> committed = new ArrayList<>();
        committed.add(UploadManifest.Entry.builder()
                .shardIndex(1).revision("17").sizeBytes(2048).checksum("4waSgw==").rowCount(3)
                .committedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build());
        return UploadManifest.builder()
                .datasetId(datasetId)
                .runId("run-1")
                .planFingerprint("abc123")
                .plannedShardCount(4)
                .createdAt(Instant.parse("2026-03-01T09:00:00Z"))
                .updatedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .committed(committed)
                .build();
    }

    @Test
    @DisplayName("Should read back what it saved")
    void testSaveAndLoad() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        UploadManifest saved = manifest("ds004884");

        store.save(saved);
        UploadManifest loaded = store.load("ds004884").orElseThrow();

        assertEquals(saved, loaded);
        assertTrue(Files.exists(stateDir.resolve("ds004884.manifest.json")));
    }

    @Test
    @DisplayName("Should leave no temp files behind")
    void testSave_NoTempFiles() throws Exception {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        store.save(manifest("ds"));
        store.save(manifest("ds"));

        try (var files = Files.list(stateDir)) {
            assertEquals(List.of("ds.manifest.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    @DisplayName("Should return empty when no manifest exists")
    void testLoad_Absent() {
        assertTrue(new FileUploadManifestStore(stateDir).load("unknown").isEmpty());
    }

    @Test
    @DisplayName("Should raise ManifestCorruptionException for unparsable JSON")
    void testLoad_Garbage() throws Exception {
        Files.writeString(stateDir.resolve("ds.manifest.json"), "{ not json");

        assertThrows(ManifestCorruptionException.class, () -> new FileUploadManifestStore(stateDir).load("ds"));
    }

    @Test
    @DisplayName("Should raise ManifestCorruptionException for unknown fields")
    void testLoad_UnknownField() throws Exception {
        Files.writeString(stateDir.resolve("ds.manifest.json"), "{\"datasetId\":\"ds\",\"surprise\":1}");

        assertThrows(ManifestCorruptionException.class, () -> new FileUploadManifestStore(stateDir).load("ds"));
    }

    @Test
    @DisplayName("Should reject dataset ids that escape the state directory")
    void testFileFor_InvalidId() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);

        assertThrows(IllegalArgumentException.class, () -> store.load("../etc"));
        assertThrows(IllegalArgumentException.class, () -> store.load("a/b"));
    }
}
