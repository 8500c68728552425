package com.cdnarchiver.common.errors;

/**
 * Base type for every failure the archiver reports. Callers branch on
 * {@link #getKind()} rather than on the message.
 */
public abstract class ArchiveException extends RuntimeException {

    private final ArchiveErrorKind kind;

    protected ArchiveException(ArchiveErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ArchiveException(ArchiveErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ArchiveErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
