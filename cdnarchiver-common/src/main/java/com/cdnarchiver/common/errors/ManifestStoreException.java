package com.cdnarchiver.common.errors;

public class ManifestStoreException extends ArchiveException {

    public ManifestStoreException(String message, Throwable cause) {
        super(ArchiveErrorKind.STORAGE, message, cause);
    }
}
