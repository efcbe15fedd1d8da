package com.di.bidshub.exception;

import com.di.bidshub.upload.validation.ValidationReport;
import lombok.Getter;

/**
 * Thrown when the integrity gate finds at least one fatal finding.
 * No shard planning or upload work happens after this is raised.
 */
@Getter
public class ValidationBlockedException extends UploadPipelineException {

    private final ValidationReport report;

    public ValidationBlockedException(ValidationReport report) {
        super("Validation blocked: " + report.summary());
        this.report = report;
    }
}
