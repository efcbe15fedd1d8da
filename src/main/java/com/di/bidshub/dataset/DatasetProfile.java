package com.di.bidshub.dataset;

import com.di.bidshub.upload.scan.EntityRecord;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capability set a cohort supplies to the upload pipeline. The pipeline never branches on
 * cohort identity; everything cohort-specific is reached through this interface.
 */
public interface DatasetProfile {

    /** Lookup key, e.g. {@code arc} or {@code isles24}. */
    String kind();

    /**
     * Expected entity counts keyed by grouping key
     * ({@code dataset}, {@code subject:<id>}, {@code modality:<label>}).
     */
    Map<String, Integer> expectedCounts();

    FeatureSchema featureSchema();

    /** Modality suffixes this cohort publishes. */
    Set<String> modalities();

    /**
     * Datatype directory a modality lives in; empty string when files sit directly in
     * the session directory. Empty optional for an unknown modality.
     */
    Optional<String> datatypeFor(String modality);

    /**
     * Returns a description of the naming-convention violation, or empty when the
     * record's path is well-formed for this cohort.
     */
    default Optional<String> pathViolation(EntityRecord record) {
        return BidsPathConvention.violation(record, this);
    }
}
