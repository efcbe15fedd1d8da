package com.di.bidshub.upload.stage;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-level cancellation signal shared by every shard worker of one run.
 * Workers check it before starting a shard, before transmitting, and between retries;
 * a shard already transmitting finishes its commit.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /** @return true if this call cancelled the run, false if it was already cancelled */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
