package com.cdnarchiver.common.errors;

public class ArchiverDisabledException extends ArchiveException {

    public ArchiverDisabledException() {
        super(ArchiveErrorKind.DISABLED, "Archiver is disabled");
    }
}
