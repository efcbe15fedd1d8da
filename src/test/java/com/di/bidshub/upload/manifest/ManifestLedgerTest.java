package com.di.bidshub.upload.manifest;

import com.di.bidshub.exception.ManifestCorruptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManifestLedger Tests")
class ManifestLedgerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path stateDir;

    private static UploadManifest.Entry entry(int index) {
        return UploadManifest.Entry.builder()
                .shardIndex(index).revision("r" + index).sizeBytes(100).checksum("c").rowCount(1)
                .committedAt(CLOCK.instant())
                .build();
    }

    @Test
    @DisplayName("Should persist each append before its future completes")
    void testAppend_Durable() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger ledger = ManifestLedger.open(store, "ds", "run-1", "fp", 3, CLOCK)) {
            ledger.append(entry(1)).join();

            assertEquals(Set.of(1), store.load("ds").orElseThrow().committedIndices());
            assertFalse(ledger.isResumed());
        }
    }

    @Test
    @DisplayName("Should serialize concurrent appends without losing any")
    void testAppend_Concurrent() throws Exception {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try (ManifestLedger ledger = ManifestLedger.open(store, "ds", "run-1", "fp", 64, CLOCK)) {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                int idx = i;
                futures.add(CompletableFuture.supplyAsync(() -> ledger.append(entry(idx)), pool)
                        .thenCompose(f -> f));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(30, TimeUnit.SECONDS);

            assertTrue(ledger.isComplete());
            assertEquals(64, store.load("ds").orElseThrow().getCommitted().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should ignore a duplicate append of the same index")
    void testAppend_Duplicate() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger ledger = ManifestLedger.open(store, "ds", "run-1", "fp", 2, CLOCK)) {
            ledger.append(entry(0)).join();
            ledger.append(entry(0)).join();

            assertEquals(1, ledger.snapshot().getCommitted().size());
        }
    }

    @Test
    @DisplayName("Should reject an index outside the plan")
    void testAppend_OutOfRange() {
        try (ManifestLedger ledger = ManifestLedger.open(new FileUploadManifestStore(stateDir),
                "ds", "run-1", "fp", 2, CLOCK)) {
            CompletionException e = assertThrows(CompletionException.class, () -> ledger.append(entry(2)).join());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("Should refuse to close while planned indices are missing")
    void testClose_Incomplete() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger ledger = ManifestLedger.open(store, "ds", "run-1", "fp", 3, CLOCK)) {
            ledger.append(entry(0)).join();
            ledger.append(entry(2)).join();

            IllegalStateException e = assertThrows(IllegalStateException.class, ledger::closeManifest);
            assertTrue(e.getMessage().contains("[1]"));
            assertFalse(store.load("ds").orElseThrow().isClosed());
        }
    }

    @Test
    @DisplayName("Should close regardless of commit order")
    void testClose_OutOfOrder() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger ledger = ManifestLedger.open(store, "ds", "run-1", "fp", 3, CLOCK)) {
            IntStream.of(2, 0, 1).forEach(i -> ledger.append(entry(i)).join());
            ledger.closeManifest();

            assertTrue(store.load("ds").orElseThrow().isClosed());
            CompletionException e = assertThrows(CompletionException.class, () -> ledger.append(entry(0)).join());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("Should resume an open manifest of the same plan")
    void testOpen_Resume() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger first = ManifestLedger.open(store, "ds", "run-1", "fp", 4, CLOCK)) {
            first.append(entry(0)).join();
            first.append(entry(1)).join();
        }

        try (ManifestLedger second = ManifestLedger.open(store, "ds", "run-2", "fp", 4, CLOCK)) {
            assertTrue(second.isResumed());
            assertThat(second.committedIndices()).containsExactly(0, 1);
            assertEquals("run-2", second.snapshot().getRunId());
        }
    }

    @Test
    @DisplayName("Should supersede a closed manifest with a fresh one")
    void testOpen_SupersedeClosed() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger first = ManifestLedger.open(store, "ds", "run-1", "fp", 1, CLOCK)) {
            first.append(entry(0)).join();
            first.closeManifest();
        }

        try (ManifestLedger second = ManifestLedger.open(store, "ds", "run-2", "fp-new", 2, CLOCK)) {
            assertFalse(second.isResumed());
            assertTrue(second.committedIndices().isEmpty());
            assertFalse(store.load("ds").orElseThrow().isClosed());
        }
    }

    @Test
    @DisplayName("Should treat an open manifest of a different plan as corruption")
    void testOpen_FingerprintMismatch() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        try (ManifestLedger first = ManifestLedger.open(store, "ds", "run-1", "fp-old", 2, CLOCK)) {
            first.append(entry(0)).join();
        }

        assertThrows(ManifestCorruptionException.class,
                () -> ManifestLedger.open(store, "ds", "run-2", "fp-new", 2, CLOCK));
        assertEquals("fp-old", store.load("ds").orElseThrow().getPlanFingerprint());
    }

    @Test
    @DisplayName("Should treat duplicate entries on disk as corruption")
    void testOpen_DuplicateEntries() {
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);
        store.save(UploadManifest.builder()
                .datasetId("ds").runId("run-1").planFingerprint("fp").plannedShardCount(3)
                .committed(new ArrayList<>(List.of(entry(1), entry(1))))
                .build());

        assertThrows(ManifestCorruptionException.class,
                () -> ManifestLedger.open(store, "ds", "run-2", "fp", 3, CLOCK));
    }

    @Test
    @DisplayName("Should never discard an unreadable manifest")
    void testOpen_Unreadable() throws Exception {
        Path file = stateDir.resolve("ds.manifest.json");
        Files.writeString(file, "garbage");
        FileUploadManifestStore store = new FileUploadManifestStore(stateDir);

        assertThrows(ManifestCorruptionException.class,
                () -> ManifestLedger.open(store, "ds", "run-2", "fp", 3, CLOCK));
        assertEquals("garbage", Files.readString(file));
    }
}
