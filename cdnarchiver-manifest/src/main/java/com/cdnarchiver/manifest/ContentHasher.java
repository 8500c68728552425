package com.cdnarchiver.manifest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Streaming SHA-256 over a file, read in fixed-size chunks.
 */
public final class ContentHasher {

    static final int CHUNK_SIZE = 1024 * 1024;

    private ContentHasher() {
    }

    /**
     * @return lowercase hex digest of the file's bytes
     */
    public static String computeHash(Path path) {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + path, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
