package com.di.bidshub.upload.remote;

/**
 * Reference to a shard transfer that has been started but not yet confirmed.
 *
 * @param datasetId  target dataset
 * @param shardIndex shard position in the plan
 * @param objectName shard-scoped object identifier in the store
 */
public record TransferHandle(String datasetId, int shardIndex, String objectName) {
}
