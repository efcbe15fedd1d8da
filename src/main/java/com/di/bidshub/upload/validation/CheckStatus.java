package com.di.bidshub.upload.validation;

public enum CheckStatus {
    PASS,
    /** Surfaced but not blocking, e.g. a partial mirror accepted under tolerance. */
    WARN,
    /** Fatal: blocks shard planning. */
    FAIL
}
