package com.di.bidshub.exception;

/**
 * The persisted upload manifest is unreadable or inconsistent with the current plan.
 * Requires operator intervention; the manifest file is never discarded automatically.
 */
public class ManifestCorruptionException extends UploadPipelineException {

    public ManifestCorruptionException(String message) {
        super(message);
    }

    public ManifestCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
