package com.cdnarchiver.common.errors;

public class ArchiveNotFoundException extends ArchiveException {

    private final String contentHash;

    public ArchiveNotFoundException(String contentHash) {
        super(ArchiveErrorKind.NOT_FOUND, "No archive record for " + contentHash);
        this.contentHash = contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }
}
