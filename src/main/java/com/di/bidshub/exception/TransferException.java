package com.di.bidshub.exception;

import lombok.Getter;

/**
 * Failure while moving a shard (or a manifest entry) to the remote store.
 * {@link #isRetryable()} tells the uploader whether another attempt makes sense.
 */
@Getter
public class TransferException extends UploadPipelineException {

    private final boolean retryable;

    public TransferException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TransferException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
