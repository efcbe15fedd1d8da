package com.di.bidshub.exception;

import com.google.cloud.storage.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Classifies pipeline failures and decides whether a shard attempt may be retried.
 * <p>Usage: {@code FailureCategory.categorize(ex).isRetryable()}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum FailureCategory {

    RATE_LIMITED("Rate limited", "Remote store asked the client to slow down", true),
    NETWORK_ERROR("Network error", "Network communication failure", true),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded its time limit", true),
    CORRUPT_BATCH("Corrupt batch", "Remote copy did not match the locally computed size or checksum", true),
    ENCODING_ERROR("Encoding error", "A record payload could not be read or encoded", true),
    PERMISSION_ERROR("Permission denied", "Credentials lack access to the remote store or local file", false),
    VALIDATION_ERROR("Validation error", "Input or configuration violates a precondition", false),
    MANIFEST_ERROR("Manifest error", "Persisted upload manifest is unreadable or inconsistent", false),
    UNKNOWN("Unknown error", "Unclassified failure", false);

    private final String name;
    private final String description;
    private final boolean retryable;

    FailureCategory(String name, String description, boolean retryable) {
        this.name = name;
        this.description = description;
        this.retryable = retryable;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, FailureCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(FailureCategory::isManifestError, MANIFEST_ERROR);
        MATCHERS.put(FailureCategory::isRateLimited, RATE_LIMITED);
        MATCHERS.put(FailureCategory::isPermissionError, PERMISSION_ERROR);
        MATCHERS.put(FailureCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(FailureCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(t -> t instanceof EncodingException, ENCODING_ERROR);
        MATCHERS.put(FailureCategory::isValidationError, VALIDATION_ERROR);
    }

    public static FailureCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof TransferException te) {
            FailureCategory byCause = te.getCause() == null ? UNKNOWN : categorize(te.getCause());
            if (byCause != UNKNOWN) {
                return byCause;
            }
            if (messageContains(te, "checksum", "size mismatch")) {
                return CORRUPT_BATCH;
            }
            return te.isRetryable() ? NETWORK_ERROR : UNKNOWN;
        }
        if (exception instanceof StorageException se) {
            return categorizeStorageException(se);
        }
        for (Map.Entry<Predicate<Throwable>, FailureCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static FailureCategory categorizeStorageException(StorageException se) {
        int code = se.getCode();
        if (code == 429) return RATE_LIMITED;
        if (code == 408) return TIMEOUT_ERROR;
        if (code == 401 || code == 403) return PERMISSION_ERROR;
        if (code >= 500 || se.isRetryable()) return NETWORK_ERROR;
        if (code == 0 && se.getCause() != null) return categorize(se.getCause());
        return UNKNOWN;
    }

    // --- Matcher helpers ---

    private static boolean isManifestError(Throwable t) {
        return t instanceof ManifestCorruptionException;
    }

    private static boolean isRateLimited(Throwable t) {
        return messageContains(t, "429", "rate limit", "too many requests", "slow down");
    }

    private static boolean isPermissionError(Throwable t) {
        return t instanceof java.nio.file.AccessDeniedException
                || messageContains(t, "forbidden", "unauthorized", "access denied", "permission denied");
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException
                        && !(t instanceof java.nio.file.FileSystemException)
                        && !(t instanceof java.io.FileNotFoundException));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof ValidationBlockedException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
