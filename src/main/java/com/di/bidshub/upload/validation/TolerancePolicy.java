package com.di.bidshub.upload.validation;

/**
 * Decides how far below its expected count an entity group may fall and still pass.
 */
public interface TolerancePolicy {

    /** Smallest observed count accepted for {@code expected}. */
    long minimumAccepted(long expected);

    /** Short form written into validation reports, e.g. {@code fraction=0.5}. */
    String describe();

    static TolerancePolicy fraction(double tolerance) {
        return new FractionalTolerance(tolerance);
    }

    static TolerancePolicy absolute(long allowedMissing) {
        return new AbsoluteTolerance(allowedMissing);
    }
}
