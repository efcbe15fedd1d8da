package com.di.bidshub.upload.manifest;

import java.util.Optional;

/**
 * Persistence for {@link UploadManifest}, keyed by dataset id.
 */
public interface UploadManifestStore {

    /**
     * @throws com.di.bidshub.exception.ManifestCorruptionException if a manifest exists but
     *         cannot be read
     */
    Optional<UploadManifest> load(String datasetId);

    /** Replaces the stored manifest atomically. */
    void save(UploadManifest manifest);
}
