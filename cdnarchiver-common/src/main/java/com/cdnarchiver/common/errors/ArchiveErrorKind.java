package com.cdnarchiver.common.errors;

/**
 * Failure categories surfaced by the archiver.
 */
public enum ArchiveErrorKind {
    CONFIGURATION("configuration", false),
    DISABLED("disabled", false),
    POLICY_DENIED("policy_denied", false),
    SIZE_LIMIT_UNCOMPRESSIBLE("size_limit_uncompressible", false),
    UPLOAD_FAILURE("upload_failure", true),
    NOT_FOUND("not_found", false),
    STORAGE("storage", true);

    private final String label;
    private final boolean retryable;

    ArchiveErrorKind(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String label() {
        return label;
    }

    /** Whether repeating the same call unchanged may succeed. */
    public boolean retryable() {
        return retryable;
    }
}
