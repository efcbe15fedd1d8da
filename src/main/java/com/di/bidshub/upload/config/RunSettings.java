package com.di.bidshub.upload.config;

import com.di.bidshub.upload.stage.BackoffPolicy;
import com.di.bidshub.upload.validation.TolerancePolicy;

import java.time.Duration;

/**
 * Effective settings of one run: configuration merged with request overrides.
 */
public record RunSettings(
        TolerancePolicy tolerance,
        long            shardSizeBudgetBytes,
        int             concurrency,
        BackoffPolicy   transferBackoff,
        int             encodingMaxAttempts,
        Duration        runTimeout,
        Duration        cancelGracePeriod) {
}
