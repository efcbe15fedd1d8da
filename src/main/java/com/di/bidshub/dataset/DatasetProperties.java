package com.di.bidshub.dataset;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-cohort expected entity counts, keyed by dataset kind.
 *
 * <pre>
 * bidshub:
 *   datasets:
 *     arc:
 *       expected-counts:
 *         dataset: 1200
 *         "[modality:T1w]": 440
 * </pre>
 *
 * Grouping keys are {@code dataset}, {@code subject:<id>} and {@code modality:<label>}.
 * A kind with no entry has no count expectations (the count check is skipped).
 */
@Data
@Component
@ConfigurationProperties(prefix = "bidshub")
public class DatasetProperties {

    private Map<String, Cohort> datasets = new LinkedHashMap<>();

    public Map<String, Integer> expectedCountsFor(String kind) {
        Cohort cohort = datasets.get(kind);
        return cohort == null ? Map.of() : Map.copyOf(cohort.getExpectedCounts());
    }

    @Data
    public static class Cohort {
        private Map<String, Integer> expectedCounts = new LinkedHashMap<>();
    }
}
