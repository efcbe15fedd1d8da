package com.di.bidshub.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A single record's payload could not be read or encoded. Aborts the assembly of the
 * batch that contains it; the caller decides whether to retry the batch.
 */
@Getter
public class EncodingException extends UploadPipelineException {

    private final Path recordPath;

    public EncodingException(Path recordPath, String message, Throwable cause) {
        super("Encoding failed for " + recordPath + ": " + message, cause);
        this.recordPath = recordPath;
    }

    public EncodingException(Path recordPath, String message) {
        this(recordPath, message, null);
    }
}
