package com.di.bidshub.upload.stage;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts total attempts including the first
 * @param initial     delay before the second attempt
 * @param multiplier  growth per further attempt
 * @param max         upper bound on any single delay
 */
public record BackoffPolicy(int maxAttempts, Duration initial, double multiplier, Duration max) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("backoff delays must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1.0: " + multiplier);
        }
    }

    /** Delay to wait after failed attempt number {@code failedAttempt} (1-based). */
    public Duration delayAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        double millis = initial.toMillis() * factor;
        if (Double.isInfinite(millis) || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean canRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
