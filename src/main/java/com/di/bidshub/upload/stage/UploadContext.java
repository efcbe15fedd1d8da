package com.di.bidshub.upload.stage;

import com.di.bidshub.dataset.FeatureSchema;
import com.di.bidshub.upload.config.RunSettings;
import com.di.bidshub.upload.manifest.ManifestLedger;

/**
 * Everything a shard worker needs from its run. One instance per run, shared read-only
 * by all workers; the ledger and token are the only thread-safe mutable parts.
 *
 * @param planFingerprint scopes remote object names so that shards of different plans
 *                        never overwrite each other
 */
public record UploadContext(
        String            datasetId,
        String            runId,
        String            planFingerprint,
        FeatureSchema     schema,
        RunSettings       settings,
        ManifestLedger    ledger,
        CancellationToken cancellation) {
}
