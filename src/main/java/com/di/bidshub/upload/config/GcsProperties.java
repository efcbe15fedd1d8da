package com.di.bidshub.upload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Target bucket for published datasets.
 *
 * <pre>
 * bidshub:
 *   gcs:
 *     bucket: my-imaging-datasets
 *     prefix: bids-hub
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "bidshub.gcs")
public class GcsProperties {

    private String bucket = "";

    /** Object prefix under which every dataset lives; no leading or trailing slash. */
    private String prefix = "bids-hub";

    public String normalizedPrefix() {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        return prefix.replaceAll("^/+", "").replaceAll("/+$", "");
    }
}
