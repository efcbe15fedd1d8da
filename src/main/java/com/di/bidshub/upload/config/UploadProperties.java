package com.di.bidshub.upload.config;

import com.di.bidshub.upload.dto.UploadRequest;
import com.di.bidshub.upload.stage.BackoffPolicy;
import com.di.bidshub.upload.validation.TolerancePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binding for the upload pipeline's tunables.
 *
 * <pre>
 * bidshub:
 *   upload:
 *     tolerance: 0.0
 *     tolerance-mode: FRACTION        # or ABSOLUTE, using absolute-tolerance
 *     shard-size-budget-bytes: 536870912
 *     concurrency: 4
 *     max-attempts: 4
 *     encoding-max-attempts: 2
 *     initial-backoff: 2s
 *     backoff-multiplier: 2.0
 *     max-backoff: 60s
 *     state-dir: /var/lib/bidshub
 *     run-timeout: 12h
 *     cancel-grace-period: 5m
 *     spool-dir: /var/tmp/bidshub   # empty = JVM temp dir
 * </pre>
 *
 * Shards are streamed to spool files, so heap use stays at a few buffers per worker while
 * spool disk use peaks near {@code concurrency × shard-size-budget-bytes × 4/3}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "bidshub.upload")
public class UploadProperties {

    public enum ToleranceMode { FRACTION, ABSOLUTE }

    /** Fraction in [0,1) of expected entities that may be missing. 0 = exact. */
    private double        tolerance = 0.0;
    private ToleranceMode toleranceMode = ToleranceMode.FRACTION;

    /** Entities that may be missing per group when {@code tolerance-mode = ABSOLUTE}. */
    private long          absoluteTolerance = 0;

    private long          shardSizeBudgetBytes = 512L * 1024 * 1024;

    private int           concurrency = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));

    /** Transfer attempts per shard, first attempt included. */
    private int           maxAttempts = 4;

    /** Assembly attempts per shard before it is failed. */
    private int           encodingMaxAttempts = 2;

    private Duration      initialBackoff = Duration.ofSeconds(2);
    private double        backoffMultiplier = 2.0;
    private Duration      maxBackoff = Duration.ofSeconds(60);

    private String        stateDir = Path.of(System.getProperty("java.io.tmpdir"), "bidshub-state").toString();

    private Duration      runTimeout = Duration.ofHours(12);

    /** How long in-flight shards may take to finish once a run is cancelled or timed out. */
    private Duration      cancelGracePeriod = Duration.ofMinutes(5);

    /** Directory for serialized shards awaiting transfer; blank means the JVM temp dir. */
    private String        spoolDir;

    /**
     * @throws IllegalArgumentException when a merged value is out of range
     */
    public RunSettings resolve(UploadRequest request) {
        long budget = request.getShardSizeBudgetBytes() != null
                ? request.getShardSizeBudgetBytes() : shardSizeBudgetBytes;
        int workers = request.getConcurrency() != null ? request.getConcurrency() : concurrency;

        if (budget <= 0) {
            throw new IllegalArgumentException("shard size budget must be > 0: " + budget);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + workers);
        }
        if (encodingMaxAttempts < 1) {
            throw new IllegalArgumentException("encoding-max-attempts must be >= 1: " + encodingMaxAttempts);
        }

        TolerancePolicy policy;
        if (request.getTolerance() != null) {
            policy = TolerancePolicy.fraction(request.getTolerance());
        } else if (toleranceMode == ToleranceMode.ABSOLUTE) {
            policy = TolerancePolicy.absolute(absoluteTolerance);
        } else {
            policy = TolerancePolicy.fraction(tolerance);
        }

        return new RunSettings(
                policy,
                budget,
                workers,
                new BackoffPolicy(maxAttempts, initialBackoff, backoffMultiplier, maxBackoff),
                encodingMaxAttempts,
                runTimeout,
                cancelGracePeriod);
    }
}
