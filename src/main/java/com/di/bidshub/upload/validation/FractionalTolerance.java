package com.di.bidshub.upload.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Accepts {@code observed >= ceil(expected * (1 - tolerance))}, tolerance in [0, 1).
 * Computed in decimal so that e.g. {@code 10 * (1 - 0.3)} is exactly 7.
 */
public record FractionalTolerance(double tolerance) implements TolerancePolicy {

    public FractionalTolerance {
        if (Double.isNaN(tolerance) || tolerance < 0.0 || tolerance >= 1.0) {
            throw new IllegalArgumentException("tolerance must be in [0,1): " + tolerance);
        }
    }

    @Override
    public long minimumAccepted(long expected) {
        if (expected <= 0) {
            return 0;
        }
        BigDecimal keep = BigDecimal.ONE.subtract(BigDecimal.valueOf(tolerance));
        return BigDecimal.valueOf(expected).multiply(keep)
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    @Override
    public String describe() {
        return "fraction=" + tolerance;
    }
}
