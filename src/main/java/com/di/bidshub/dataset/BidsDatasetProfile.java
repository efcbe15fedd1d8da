package com.di.bidshub.dataset;

import lombok.Builder;
import lombok.Singular;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table-driven {@link DatasetProfile} for a BIDS cohort: a kind, a modality → datatype
 * map, a feature schema and expected counts.
 */
@Builder
public final class BidsDatasetProfile implements DatasetProfile {

    private final String kind;
    @Singular
    private final Map<String, String> modalityDatatypes;
    private final FeatureSchema featureSchema;
    @Singular
    private final Map<String, Integer> expectedCounts;

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Map<String, Integer> expectedCounts() {
        return expectedCounts;
    }

    @Override
    public FeatureSchema featureSchema() {
        return featureSchema == null ? FeatureSchema.bidsDefault() : featureSchema;
    }

    @Override
    public Set<String> modalities() {
        return modalityDatatypes.keySet();
    }

    @Override
    public Optional<String> datatypeFor(String modality) {
        return Optional.ofNullable(modalityDatatypes.get(modality));
    }

    @Override
    public String toString() {
        return "BidsDatasetProfile[" + kind + ", modalities=" + modalityDatatypes.keySet() + "]";
    }
}
