package com.cdnarchiver.common.errors;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveExceptionTest {

    @Test
    void everyExceptionCarriesItsKind() {
        assertEquals(ArchiveErrorKind.CONFIGURATION, new ConfigurationException("x").getKind());
        assertEquals(ArchiveErrorKind.DISABLED, new ArchiverDisabledException().getKind());
        assertEquals(ArchiveErrorKind.POLICY_DENIED, new PolicyDeniedException(List.of("a")).getKind());
        assertEquals(ArchiveErrorKind.SIZE_LIMIT_UNCOMPRESSIBLE,
                new SizeLimitUncompressibleException("videos", 10, 5).getKind());
        assertEquals(ArchiveErrorKind.UPLOAD_FAILURE, new UploadFailureException("x").getKind());
        assertEquals(ArchiveErrorKind.NOT_FOUND, new ArchiveNotFoundException("abc").getKind());
        assertEquals(ArchiveErrorKind.NOT_FOUND, new AttachmentNotFoundException("1", "2").getKind());
        assertEquals(ArchiveErrorKind.STORAGE, new ManifestStoreException("x", null).getKind());
    }

    @Test
    void onlyTransportAndStorageFailuresAreRetryable() {
        assertTrue(new UploadFailureException("x").isRetryable());
        assertTrue(new ManifestStoreException("x", null).isRetryable());
        assertFalse(new PolicyDeniedException(List.of("a")).isRetryable());
        assertFalse(new ConfigurationException("x").isRetryable());
    }

    @Test
    void policyDeniedKeepsAllReasons() {
        var e = new PolicyDeniedException(List.of("unknown file type: .xyz", "file too large"));
        assertEquals(2, e.getReasons().size());
        assertTrue(e.getMessage().contains("unknown file type"));
        assertTrue(e.getMessage().contains("file too large"));
    }

    @Test
    void sizeLimitReportsSizeAndLimit() {
        var e = new SizeLimitUncompressibleException("videos", 2048, 1024);
        assertEquals(2048, e.getSize());
        assertEquals(1024, e.getLimit());
        assertTrue(e.getMessage().contains("videos"));
    }
}
