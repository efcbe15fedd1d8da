package com.di.bidshub.upload.validation;

/**
 * Accepts up to {@code allowedMissing} entities below the expected count per group.
 */
public record AbsoluteTolerance(long allowedMissing) implements TolerancePolicy {

    public AbsoluteTolerance {
        if (allowedMissing < 0) {
            throw new IllegalArgumentException("allowedMissing must be >= 0: " + allowedMissing);
        }
    }

    @Override
    public long minimumAccepted(long expected) {
        return Math.max(0, expected - allowedMissing);
    }

    @Override
    public String describe() {
        return "absolute=" + allowedMissing;
    }
}
