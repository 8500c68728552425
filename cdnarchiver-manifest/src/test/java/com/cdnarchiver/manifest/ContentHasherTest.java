package com.cdnarchiver.manifest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    @TempDir
    Path dir;

    @Test
    void knownDigest() throws IOException {
        Path file = Files.writeString(dir.resolve("abc.txt"), "abc", StandardCharsets.US_ASCII);
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ContentHasher.computeHash(file));
    }

    @Test
    void emptyFile() throws IOException {
        Path file = Files.createFile(dir.resolve("empty"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentHasher.computeHash(file));
    }

    @Test
    void stableAcrossCallsAndCopiesSpanningChunks() throws IOException {
        byte[] data = new byte[ContentHasher.CHUNK_SIZE * 2 + 17];
        new Random(7).nextBytes(data);
        Path a = Files.write(dir.resolve("a.bin"), data);
        Path b = Files.write(dir.resolve("b.bin"), data);

        String first = ContentHasher.computeHash(a);
        assertEquals(first, ContentHasher.computeHash(a));
        assertEquals(first, ContentHasher.computeHash(b));
        assertEquals(64, first.length());

        data[data.length - 1] ^= 1;
        Files.write(b, data);
        assertNotEquals(first, ContentHasher.computeHash(b));
    }

    @Test
    void missingFileFails() {
        assertThrows(UncheckedIOException.class, () -> ContentHasher.computeHash(dir.resolve("missing")));
    }
}
