package com.di.bidshub.upload.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of every integrity check run against a record set. A report with any
 * {@link CheckStatus#FAIL} check is {@link Status#BLOCKED}; callers must not plan shards
 * from a blocked report.
 */
@Value
@Builder
public class ValidationReport {

    public enum Status { PASSED, PASSED_WITH_WARNINGS, BLOCKED }

    String            datasetKind;
    int               recordCount;
    long              totalBytes;
    Instant           createdAt;

    @Singular
    List<CheckResult> checks;

    public Status getStatus() {
        if (checks.stream().anyMatch(CheckResult::isFatal)) {
            return Status.BLOCKED;
        }
        return checks.stream().anyMatch(c -> c.getStatus() == CheckStatus.WARN)
                ? Status.PASSED_WITH_WARNINGS
                : Status.PASSED;
    }

    @JsonIgnore
    public boolean isBlocked() {
        return getStatus() == Status.BLOCKED;
    }

    @JsonIgnore
    public List<CheckResult> getFatalFindings() {
        return checks.stream().filter(CheckResult::isFatal).toList();
    }

    @JsonIgnore
    public List<CheckResult> getWarnings() {
        return checks.stream().filter(c -> c.getStatus() == CheckStatus.WARN).toList();
    }

    public String summary() {
        return String.format("%s: %d record(s), %d check(s), %d fatal, %d warning(s)",
                getStatus(), recordCount, checks.size(), getFatalFindings().size(), getWarnings().size());
    }
}
