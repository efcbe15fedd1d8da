package com.di.bidshub.exception;

/**
 * Thrown when the dataset root is missing or unreadable. Fatal: the run aborts immediately.
 */
public class ScanException extends UploadPipelineException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
