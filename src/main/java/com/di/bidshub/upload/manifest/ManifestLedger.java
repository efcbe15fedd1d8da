package com.di.bidshub.upload.manifest;

import com.di.bidshub.exception.ManifestCorruptionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single owner of a run's {@link UploadManifest}.
 *
 * <p>Every read and mutation is a task on one dedicated writer thread, reached through
 * that thread's queue, so concurrent shard workers never race on the manifest. Each
 * append is persisted before its future completes.
 */
@Slf4j
public final class ManifestLedger implements AutoCloseable {

    private final UploadManifestStore store;
    private final UploadManifest      manifest;
    private final Clock               clock;
    private final boolean             resumed;
    private final ExecutorService     writer;

    private ManifestLedger(UploadManifestStore store, UploadManifest manifest, Clock clock, boolean resumed) {
        this.store    = store;
        this.manifest = manifest;
        this.clock    = clock;
        this.resumed  = resumed;
        this.writer   = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "manifest-writer-" + manifest.getDatasetId());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Resumes the open manifest for {@code datasetId} when it belongs to the same plan,
     * otherwise starts a new one. A closed manifest is superseded.
     *
     * @throws ManifestCorruptionException if an open manifest is unreadable, inconsistent,
     *                                     or was written for a different plan
     */
    public static ManifestLedger open(UploadManifestStore store,
                                      String datasetId,
                                      String runId,
                                      String planFingerprint,
                                      int plannedShardCount,
                                      Clock clock) {

        Optional<UploadManifest> existing = store.load(datasetId);

        if (existing.isPresent() && !existing.get().isClosed()) {
            UploadManifest m = existing.get();
            verifyResumable(m, datasetId, planFingerprint, plannedShardCount);
            log.info("[MANIFEST] resuming dataset={} previousRun={} committed={}/{}",
                    datasetId, m.getRunId(), m.getCommitted().size(), plannedShardCount);
            m.setRunId(runId);
            m.setUpdatedAt(clock.instant());
            store.save(m);
            return new ManifestLedger(store, m, clock, true);
        }

        existing.ifPresent(old -> log.info("[MANIFEST] superseding closed manifest of run {} for dataset={}",
                old.getRunId(), datasetId));

        UploadManifest fresh = UploadManifest.builder()
                .datasetId(datasetId)
                .runId(runId)
                .planFingerprint(planFingerprint)
                .plannedShardCount(plannedShardCount)
                .closed(false)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .committed(new ArrayList<>())
                .build();
        store.save(fresh);
        log.info("[MANIFEST] created dataset={} run={} plannedShards={}", datasetId, runId, plannedShardCount);
        return new ManifestLedger(store, fresh, clock, false);
    }

    public boolean isResumed() {
        return resumed;
    }

    public Set<Integer> committedIndices() {
        return call(manifest::committedIndices);
    }

    public boolean isComplete() {
        return call(manifest::isComplete);
    }

    /**
     * Queues the entry; the future completes once it is durable. Re-appending an index that
     * is already present is a no-op.
     */
    public CompletableFuture<Void> append(UploadManifest.Entry entry) {
        return CompletableFuture.runAsync(() -> {
            if (manifest.isClosed()) {
                throw new IllegalStateException("Manifest for " + manifest.getDatasetId() + " is already closed");
            }
            int idx = entry.getShardIndex();
            if (idx < 0 || idx >= manifest.getPlannedShardCount()) {
                throw new IllegalArgumentException("shard index " + idx + " outside plan of "
                        + manifest.getPlannedShardCount());
            }
            if (manifest.committedIndices().contains(idx)) {
                log.warn("[MANIFEST] shard={} already committed; ignoring duplicate append", idx);
                return;
            }
            manifest.getCommitted().add(entry);
            manifest.setUpdatedAt(clock.instant());
            store.save(manifest);
            log.debug("[MANIFEST] committed shard={} revision={} ({}/{})", idx, entry.getRevision(),
                    manifest.getCommitted().size(), manifest.getPlannedShardCount());
        }, writer);
    }

    /**
     * Marks the manifest complete.
     *
     * @throws IllegalStateException if any planned shard index is missing
     */
    public void closeManifest() {
        call(() -> {
            if (!manifest.isComplete()) {
                Set<Integer> missing = new HashSet<>();
                Set<Integer> have = manifest.committedIndices();
                for (int i = 0; i < manifest.getPlannedShardCount(); i++) {
                    if (!have.contains(i)) missing.add(i);
                }
                throw new IllegalStateException("Cannot close manifest for " + manifest.getDatasetId()
                        + "; missing shard(s) " + missing);
            }
            manifest.setClosed(true);
            manifest.setUpdatedAt(clock.instant());
            store.save(manifest);
            log.info("[MANIFEST] closed dataset={} shards={}", manifest.getDatasetId(), manifest.getPlannedShardCount());
            return null;
        });
    }

    /** Copy of the current state, safe to hand out. */
    public UploadManifest snapshot() {
        return call(() -> manifest.toBuilder().committed(new ArrayList<>(manifest.getCommitted())).build());
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("[MANIFEST] writer for {} did not drain within 30s", manifest.getDatasetId());
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    /* ------------------------------------------------------------------ */

    private <T> T call(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, writer).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private static void verifyResumable(UploadManifest m, String datasetId,
                                        String planFingerprint, int plannedShardCount) {
        if (!datasetId.equals(m.getDatasetId())) {
            throw new ManifestCorruptionException("Manifest file for " + datasetId
                    + " records dataset " + m.getDatasetId());
        }
        if (m.getCommitted() == null) {
            throw new ManifestCorruptionException("Manifest for " + datasetId + " has no committed list");
        }
        if (m.getPlannedShardCount() != plannedShardCount
                || !planFingerprint.equals(m.getPlanFingerprint())) {
            throw new ManifestCorruptionException(String.format(
                    "Open manifest for %s was written for a different plan (shards %d vs %d, fingerprint %s vs %s); "
                            + "the input changed since the interrupted run",
                    datasetId, m.getPlannedShardCount(), plannedShardCount,
                    abbreviate(m.getPlanFingerprint()), abbreviate(planFingerprint)));
        }
        Set<Integer> seen = new HashSet<>();
        List<Integer> bad = new ArrayList<>();
        for (UploadManifest.Entry e : m.getCommitted()) {
            if (e == null || e.getShardIndex() < 0 || e.getShardIndex() >= plannedShardCount
                    || !seen.add(e.getShardIndex())) {
                bad.add(e == null ? null : e.getShardIndex());
            }
        }
        if (!bad.isEmpty()) {
            throw new ManifestCorruptionException("Manifest for " + datasetId
                    + " has out-of-range or duplicate shard entries: " + bad);
        }
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint == null ? "null" : fingerprint.substring(0, Math.min(12, fingerprint.length()));
    }
}
