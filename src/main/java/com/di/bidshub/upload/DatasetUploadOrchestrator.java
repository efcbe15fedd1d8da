package com.di.bidshub.upload;

import com.di.bidshub.dataset.DatasetProfile;
import com.di.bidshub.dataset.DatasetProfileRegistry;
import com.di.bidshub.exception.ScanException;
import com.di.bidshub.exception.TransferException;
import com.di.bidshub.exception.ValidationBlockedException;
import com.di.bidshub.upload.config.RunSettings;
import com.di.bidshub.upload.config.UploadProperties;
import com.di.bidshub.upload.dto.RunReport;
import com.di.bidshub.upload.dto.UploadRequest;
import com.di.bidshub.upload.manifest.ManifestLedger;
import com.di.bidshub.upload.manifest.UploadManifest;
import com.di.bidshub.upload.manifest.UploadManifestStore;
import com.di.bidshub.upload.plan.ShardDescriptor;
import com.di.bidshub.upload.plan.ShardPlanner;
import com.di.bidshub.upload.remote.RemoteStore;
import com.di.bidshub.upload.scan.EntityRecord;
import com.di.bidshub.upload.scan.EntityScanner;
import com.di.bidshub.upload.stage.CancellationToken;
import com.di.bidshub.upload.stage.ShardOutcome;
import com.di.bidshub.upload.stage.ShardUploadStage;
import com.di.bidshub.upload.stage.UploadContext;
import com.di.bidshub.upload.validation.IntegrityValidator;
import com.di.bidshub.upload.validation.ValidationReport;
import com.di.bidshub.util.UploadMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the build-validate-shard-upload pipeline.
 *
 * <pre>
 *   scan ──► validate ──(blocked? abort)──► plan ──► open ledger ──► upload pending shards
 *                                                                          │
 *                                          all planned shards committed? ──┴──► finalize + close
 * </pre>
 *
 * <h3>Run lifecycle</h3>
 * <ol>
 *   <li>Resolve the dataset profile and the effective expected counts.</li>
 *   <li>Scan the tree (stat only) and validate; a blocked report aborts the run before
 *       anything is planned or uploaded.</li>
 *   <li>Plan shards deterministically and open the manifest ledger, resuming an interrupted
 *       run of the same plan.</li>
 *   <li>Upload every shard the ledger does not already hold.</li>
 *   <li>Publish the remote manifest and close the ledger only when every planned shard is
 *       committed.</li>
 * </ol>
 *
 * One run per dataset id at a time.
 */
@Slf4j
@Service
public class DatasetUploadOrchestrator {

    private final DatasetProfileRegistry profiles;
    private final UploadProperties       uploadProperties;
    private final EntityScanner          scanner;
    private final IntegrityValidator     validator;
    private final ShardPlanner           planner;
    private final ShardUploadStage       uploadStage;
    private final UploadManifestStore    manifestStore;
    private final RemoteStore            remoteStore;
    private final UploadMetrics          metrics;
    private final Clock                  clock;

    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public DatasetUploadOrchestrator(DatasetProfileRegistry profiles,
                                     UploadProperties uploadProperties,
                                     EntityScanner scanner,
                                     IntegrityValidator validator,
                                     ShardPlanner planner,
                                     ShardUploadStage uploadStage,
                                     UploadManifestStore manifestStore,
                                     RemoteStore remoteStore,
                                     UploadMetrics metrics) {
        this(profiles, uploadProperties, scanner, validator, planner, uploadStage,
             manifestStore, remoteStore, metrics, Clock.systemUTC());
    }

    DatasetUploadOrchestrator(DatasetProfileRegistry profiles,
                              UploadProperties uploadProperties,
                              EntityScanner scanner,
                              IntegrityValidator validator,
                              ShardPlanner planner,
                              ShardUploadStage uploadStage,
                              UploadManifestStore manifestStore,
                              RemoteStore remoteStore,
                              UploadMetrics metrics,
                              Clock clock) {
        this.profiles         = profiles;
        this.uploadProperties = uploadProperties;
        this.scanner          = scanner;
        this.validator        = validator;
        this.planner          = planner;
        this.uploadStage      = uploadStage;
        this.manifestStore    = manifestStore;
        this.remoteStore      = remoteStore;
        this.metrics          = metrics;
        this.clock            = clock;
    }

    /* ------------------------------------------------------------------ */
    /* Public API                                                           */
    /* ------------------------------------------------------------------ */

    /**
     * Runs the full pipeline for one dataset.
     *
     * @throws ScanException               root missing, unreadable or without entities
     * @throws ValidationBlockedException  the validation report has a fatal finding
     * @throws com.di.bidshub.exception.ManifestCorruptionException
     *                                     the persisted manifest cannot be resumed
     * @throws IllegalStateException       a run for the same dataset is already active
     */
    public RunReport execute(UploadRequest request) {
        String  runId     = UUID.randomUUID().toString();
        String  datasetId = request.getDatasetId();
        Instant startedAt = clock.instant();

        CancellationToken token = new CancellationToken();
        if (activeRuns.putIfAbsent(datasetId, token) != null) {
            throw new IllegalStateException("An upload of dataset " + datasetId + " is already running");
        }

        MDC.put("datasetId", datasetId);
        MDC.put("runId", runId);
        try {
            log.info("[ORCHESTRATOR] runId={} dataset={} kind={} root={}",
                    runId, datasetId, request.getDatasetKind(), request.getDatasetRoot());

            RunSettings        settings = uploadProperties.resolve(request);
            DatasetProfile     profile  = profiles.getProfile(request.getDatasetKind());
            List<EntityRecord> records  = scan(request);

            ValidationReport report = validator.validate(records, expectedCounts(request, profile),
                    settings.tolerance(), profile);
            if (report.isBlocked()) {
                log.error("[ORCHESTRATOR] runId={} blocked by validation: {}", runId, report.summary());
                throw new ValidationBlockedException(report);
            }

            List<ShardDescriptor> plan        = planner.plan(records, settings.shardSizeBudgetBytes());
            String                fingerprint = ShardPlanner.fingerprint(plan);

            try (ManifestLedger ledger = ManifestLedger.open(manifestStore, datasetId, runId,
                    fingerprint, plan.size(), clock)) {

                Set<Integer>          alreadyCommitted = ledger.committedIndices();
                List<ShardDescriptor> pending          = plan.stream()
                        .filter(s -> !alreadyCommitted.contains(s.shardIndex()))
                        .toList();
                if (!alreadyCommitted.isEmpty()) {
                    log.info("[ORCHESTRATOR] runId={} skipping {} shard(s) committed by an earlier run",
                            runId, alreadyCommitted.size());
                    metrics.recordSkipped(alreadyCommitted.size());
                }

                UploadContext      ctx      = new UploadContext(datasetId, runId, fingerprint,
                        profile.featureSchema(), settings, ledger, token);
                List<ShardOutcome> outcomes = uploadStage.execute(ctx, pending);

                RunReport.RunReportBuilder out = RunReport.builder()
                        .runId(runId)
                        .datasetId(datasetId)
                        .datasetKind(profile.kind())
                        .validation(report)
                        .planFingerprint(fingerprint)
                        .plannedShardCount(plan.size())
                        .resumed(ledger.isResumed())
                        .skipped(alreadyCommitted.stream().sorted().toList())
                        .startedAt(startedAt);
                collect(outcomes, out);

                RunReport result = out.build();
                finish(result, ledger, token);
                result.setFinishedAt(clock.instant());
                result.setDurationMillis(Duration.between(startedAt, result.getFinishedAt()).toMillis());

                log.info("[ORCHESTRATOR] runId={} {} committed={} skipped={} failed={} cancelled={} bytes={} in {}ms",
                        runId, result.getStatus(), result.getCommitted().size(), result.getSkipped().size(),
                        result.getFailed().size(), result.getCancelled().size(),
                        result.getBytesTransmitted(), result.getDurationMillis());
                return result;
            }
        } finally {
            activeRuns.remove(datasetId, token);
            MDC.remove("datasetId");
            MDC.remove("runId");
        }
    }

    /** Scan and validate only; nothing is planned, uploaded or persisted. */
    public ValidationReport validateOnly(UploadRequest request) {
        RunSettings    settings = uploadProperties.resolve(request);
        DatasetProfile profile  = profiles.getProfile(request.getDatasetKind());
        List<EntityRecord> records = scan(request);
        return validator.validate(records, expectedCounts(request, profile), settings.tolerance(), profile);
    }

    /**
     * Signals the active run of {@code datasetId} to stop issuing new shard work.
     *
     * @return false when no run of that dataset is active
     */
    public boolean cancel(String datasetId) {
        CancellationToken token = activeRuns.get(datasetId);
        if (token == null) {
            return false;
        }
        if (token.cancel("cancelled by operator")) {
            log.warn("[ORCHESTRATOR] cancellation requested for dataset={}", datasetId);
        }
        return true;
    }

    public Optional<UploadManifest> manifest(String datasetId) {
        return manifestStore.load(datasetId);
    }

    public Set<String> activeDatasets() {
        return Set.copyOf(activeRuns.keySet());
    }

    /* ------------------------------------------------------------------ */
    /* Private helpers                                                      */
    /* ------------------------------------------------------------------ */

    private List<EntityRecord> scan(UploadRequest request) {
        Path root = Path.of(request.getDatasetRoot());
        List<EntityRecord> records = scanner.scanAll(root);
        if (records.isEmpty()) {
            throw new ScanException("No NIfTI entities found under " + root.toAbsolutePath()
                    + " (expected sub-*/ses-*/<datatype>/*.nii[.gz])");
        }
        return records;
    }

    /** Request counts take precedence over the profile's configured counts. */
    private static Map<String, Integer> expectedCounts(UploadRequest request, DatasetProfile profile) {
        Map<String, Integer> override = request.getExpectedCounts();
        return override != null && !override.isEmpty() ? override : profile.expectedCounts();
    }

    private static void collect(List<ShardOutcome> outcomes, RunReport.RunReportBuilder out) {
        List<Integer>        committed = new ArrayList<>();
        List<Integer>        cancelled = new ArrayList<>();
        Map<Integer, String> failed    = new LinkedHashMap<>();
        long bytes = 0;
        for (ShardOutcome o : outcomes) {
            if (o.isCommitted()) {
                committed.add(o.shardIndex());
                bytes += o.bytesTransmitted();
            } else if (o.isFailed()) {
                failed.put(o.shardIndex(), o.failure().getMessage());
            } else {
                cancelled.add(o.shardIndex());
            }
        }
        out.committed(committed).failed(failed).cancelled(cancelled).bytesTransmitted(bytes);
    }

    /**
     * Publishes and closes only when the ledger holds every planned index. The published
     * manifest covers exactly this plan's shards. A failed publish leaves the ledger open;
     * the next run skips every shard and publishes again.
     */
    private void finish(RunReport result, ManifestLedger ledger, CancellationToken token) {
        if (ledger.isComplete()) {
            try {
                remoteStore.finalizeManifest(result.getDatasetId(), result.getPlanFingerprint(),
                        result.getPlannedShardCount());
                ledger.closeManifest();
                result.setStatus(RunReport.Status.COMPLETE);
                result.setMessage("All " + result.getPlannedShardCount() + " shard(s) committed; manifest published");
                return;
            } catch (TransferException e) {
                log.error("[ORCHESTRATOR] runId={} manifest publish failed: {}", result.getRunId(), e.getMessage(), e);
                result.setStatus(RunReport.Status.INCOMPLETE);
                result.setMessage("All shards committed but manifest publish failed: " + e.getMessage());
                return;
            }
        }
        if (token.isCancelled()) {
            result.setStatus(RunReport.Status.CANCELLED);
            result.setMessage("Run cancelled (" + token.getReason() + "); re-run to upload the remaining shards");
        } else {
            result.setStatus(RunReport.Status.INCOMPLETE);
            result.setMessage(result.getFailed().size() + " shard(s) failed; re-run to retry them");
        }
    }
}
