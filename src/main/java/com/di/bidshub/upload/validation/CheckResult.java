package com.di.bidshub.upload.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one integrity check.
 */
@Value
@Builder
public class CheckResult {

    /** {@code zero-byte}, {@code file-exists}, {@code path-shape} or {@code expected-count[<group>]}. */
    String       name;
    CheckStatus  status;

    long         observed;

    /** Null for checks that have no expectation (zero-byte, file-exists, path-shape). */
    Long         expected;

    /** Tolerance policy applied, null when none. */
    String       tolerance;

    @Singular
    List<String> offendingPaths;

    String       detail;

    public boolean isFatal() {
        return status == CheckStatus.FAIL;
    }
}
