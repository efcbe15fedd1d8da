package com.di.bidshub.exception;

import lombok.Getter;

/**
 * A shard exhausted its attempts. Sibling shards keep running; the manifest is never
 * finalized while this shard is outstanding.
 */
@Getter
public class ShardFailedException extends UploadPipelineException {

    private final int shardIndex;
    private final int attempts;

    public ShardFailedException(int shardIndex, int attempts, Throwable cause) {
        super(String.format("shard-%d failed after %d attempt(s): %s",
                shardIndex, attempts, cause == null ? "unknown" : cause.getMessage()), cause);
        this.shardIndex = shardIndex;
        this.attempts = attempts;
    }
}
