package com.di.bidshub.dataset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cohort profiles served by this deployment.
 */
@Configuration
public class DatasetProfilesConfig {

    /** Aphasia Recovery Cohort (OpenNeuro ds004884). */
    @Bean
    public DatasetProfile arcProfile(DatasetProperties properties) {
        return BidsDatasetProfile.builder()
                .kind("arc")
                .modalityDatatype("T1w", "anat")
                .modalityDatatype("T2w", "anat")
                .modalityDatatype("FLAIR", "anat")
                .modalityDatatype("bold", "func")
                .modalityDatatype("dwi", "dwi")
                .featureSchema(FeatureSchema.bidsDefault())
                .expectedCounts(properties.expectedCountsFor("arc"))
                .build();
    }

    /**
     * ISLES'24 acute stroke. Admission CT series sit at the session root with their
     * perfusion maps under {@code perfusion-maps/}; the follow-up session holds diffusion
     * under {@code dwi/} and the lesion mask at its root.
     */
    @Bean
    public DatasetProfile isles24Profile(DatasetProperties properties) {
        return BidsDatasetProfile.builder()
                .kind("isles24")
                .modalityDatatype("ncct", "")
                .modalityDatatype("cta", "")
                .modalityDatatype("ctp", "")
                .modalityDatatype("cbf", "perfusion-maps")
                .modalityDatatype("cbv", "perfusion-maps")
                .modalityDatatype("mtt", "perfusion-maps")
                .modalityDatatype("tmax", "perfusion-maps")
                .modalityDatatype("dwi", "dwi")
                .modalityDatatype("adc", "dwi")
                .modalityDatatype("lesion-msk", "")
                .featureSchema(FeatureSchema.bidsDefault())
                .expectedCounts(properties.expectedCountsFor("isles24"))
                .build();
    }
}
