package com.di.bidshub.upload.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One dataset upload (or validate-only) invocation. Null overrides fall back to
 * {@code bidshub.upload.*} configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadRequest {

    /** Local BIDS root, e.g. {@code /data/openneuro/ds004884}. */
    @NotBlank
    private String datasetRoot;

    /** Remote dataset identifier; also names the persisted manifest. */
    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9._-]*")
    private String datasetId;

    /** Registered profile kind, e.g. {@code arc}. */
    @NotBlank
    private String datasetKind;

    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private Double tolerance;

    @Min(1)
    private Long shardSizeBudgetBytes;

    @Min(1)
    private Integer concurrency;

    /** Replaces the profile's expected counts when non-empty. */
    private Map<String, Integer> expectedCounts;
}
