package com.di.bidshub.exception;

/**
 * Base type for every failure raised by the build-validate-shard-upload pipeline.
 *
 * <p>Caught by {@link GlobalExceptionHandler} and mapped to an HTTP status by subtype.
 */
public class UploadPipelineException extends RuntimeException {

    public UploadPipelineException(String message) {
        super(message);
    }

    public UploadPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
