package com.cdnarchiver.common.errors;

/**
 * The file exceeds the upload ceiling and its kind cannot be re-encoded.
 */
public class SizeLimitUncompressibleException extends ArchiveException {

    private final long size;
    private final long limit;

    public SizeLimitUncompressibleException(String kind, long size, long limit) {
        super(ArchiveErrorKind.SIZE_LIMIT_UNCOMPRESSIBLE,
                "Cannot compress " + kind + " file of " + size + " bytes to fit limit of " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
