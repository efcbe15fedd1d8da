package com.di.bidshub.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Shard-level counters and timers for the upload pipeline.
 */
@Component
public class UploadMetrics {

    private final Counter             committed;
    private final Counter             failed;
    private final Counter             skipped;
    private final Counter             cancelled;
    private final Counter             retries;
    private final Counter             bytesTransmitted;
    private final DistributionSummary shardBytes;
    private final Timer               shardDuration;

    public UploadMetrics(MeterRegistry meterRegistry) {
        this.committed = shardCounter(meterRegistry, "committed");
        this.failed    = shardCounter(meterRegistry, "failed");
        this.skipped   = shardCounter(meterRegistry, "skipped");
        this.cancelled = shardCounter(meterRegistry, "cancelled");

        this.retries = Counter.builder("bidshub.upload.retries")
                .description("Shard assembly or transfer attempts that were retried")
                .register(meterRegistry);

        this.bytesTransmitted = Counter.builder("bidshub.upload.bytes")
                .description("Serialized bytes confirmed by the remote store")
                .baseUnit("bytes")
                .register(meterRegistry);

        this.shardBytes = DistributionSummary.builder("bidshub.upload.shard.size")
                .description("Serialized shard size")
                .baseUnit("bytes")
                .register(meterRegistry);

        this.shardDuration = Timer.builder("bidshub.upload.shard.duration")
                .description("Wall-clock time from assembly start to commit")
                .register(meterRegistry);
    }

    private static Counter shardCounter(MeterRegistry registry, String status) {
        return Counter.builder("bidshub.upload.shards")
                .description("Shards by final state")
                .tag("status", status)
                .register(registry);
    }

    public void recordCommitted(long bytes, Duration duration) {
        committed.increment();
        bytesTransmitted.increment(bytes);
        shardBytes.record(bytes);
        shardDuration.record(duration);
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordSkipped(int count) {
        skipped.increment(count);
    }

    public void recordCancelled() {
        cancelled.increment();
    }

    public void recordRetry() {
        retries.increment();
    }
}
