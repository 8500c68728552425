package com.cdnarchiver.common.errors;

/**
 * Transport or provider-side failure while uploading or fetching from the
 * storage provider. Not retried here; the caller decides.
 */
public class UploadFailureException extends ArchiveException {

    private final Integer status;

    public UploadFailureException(String message) {
        this(message, null, null);
    }

    public UploadFailureException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public UploadFailureException(String message, Integer status, Throwable cause) {
        super(ArchiveErrorKind.UPLOAD_FAILURE, message, cause);
        this.status = status;
    }

    /** Provider HTTP status, when the failure came from a response. */
    public Integer getStatus() {
        return status;
    }
}
