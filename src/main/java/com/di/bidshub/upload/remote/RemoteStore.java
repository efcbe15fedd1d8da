package com.di.bidshub.upload.remote;

import com.di.bidshub.exception.TransferException;
import com.di.bidshub.upload.assemble.SerializedShard;

/**
 * Object-and-metadata sink that receives shards and the dataset manifest.
 *
 * <p>Shard objects and manifest entries are scoped by plan fingerprint. Re-transmitting a
 * shard of the same plan replaces its object without touching other shards, and a new plan
 * never overwrites the objects a previously published manifest points at. Nothing written
 * before {@link #finalizeManifest} is visible to consumers as a complete dataset.
 *
 * <p>All methods throw {@link TransferException}; {@link TransferException#isRetryable()}
 * separates transient failures from permanent ones.
 */
public interface RemoteStore {

    TransferHandle beginShardTransfer(String datasetId, String planFingerprint, SerializedShard shard);

    TransferReceipt confirmTransfer(TransferHandle handle);

    void appendManifestEntry(String datasetId, String planFingerprint, int shardIndex, String revision);

    /**
     * Publishes the consumer-visible manifest covering shards {@code 0..plannedShardCount-1}
     * of {@code planFingerprint}, and nothing else.
     *
     * @throws TransferException when an entry of the plan is missing remotely
     */
    void finalizeManifest(String datasetId, String planFingerprint, int plannedShardCount);

    /** Object-name segment for a plan: the first 16 hex digits of its fingerprint. */
    static String planKey(String planFingerprint) {
        return planFingerprint.length() <= 16 ? planFingerprint : planFingerprint.substring(0, 16);
    }
}
