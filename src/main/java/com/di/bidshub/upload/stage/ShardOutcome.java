package com.di.bidshub.upload.stage;

import com.di.bidshub.exception.ShardFailedException;

/**
 * Final result of one shard's lifecycle within a run.
 *
 * @param state            {@code COMMITTED}, {@code FAILED}, or {@code PENDING} when cancelled
 * @param attempts         attempts spent in the phase the shard ended in
 * @param bytesTransmitted serialized bytes confirmed remotely; 0 unless committed
 * @param revision         remote revision of the committed object
 * @param failure          set only for {@code FAILED}
 */
public record ShardOutcome(
        int                  shardIndex,
        ShardState           state,
        int                  attempts,
        long                 bytesTransmitted,
        String               revision,
        ShardFailedException failure) {

    public static ShardOutcome committed(int shardIndex, int attempts, long bytes, String revision) {
        return new ShardOutcome(shardIndex, ShardState.COMMITTED, attempts, bytes, revision, null);
    }

    public static ShardOutcome failed(int shardIndex, int attempts, Throwable cause) {
        ShardFailedException failure = cause instanceof ShardFailedException sf
                ? sf : new ShardFailedException(shardIndex, attempts, cause);
        return new ShardOutcome(shardIndex, ShardState.FAILED, attempts, 0L, null, failure);
    }

    public static ShardOutcome cancelled(int shardIndex, int attempts) {
        return new ShardOutcome(shardIndex, ShardState.PENDING, attempts, 0L, null, null);
    }

    public boolean isCommitted() {
        return state == ShardState.COMMITTED;
    }

    public boolean isFailed() {
        return state == ShardState.FAILED;
    }

    public boolean isCancelled() {
        return state == ShardState.PENDING;
    }
}
