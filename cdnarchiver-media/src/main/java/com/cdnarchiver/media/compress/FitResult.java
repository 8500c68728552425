package com.cdnarchiver.media.compress;

import com.cdnarchiver.media.MediaKind;

import java.nio.file.Path;

/**
 * Output of {@link MediaCompressor#fitToLimit}: the artifact to upload and its stats.
 */
public record FitResult(Path source, Path outputPath, CompressionStats stats) {

    /** True when a new intermediate file was written. */
    public boolean compressed() {
        return !outputPath.equals(source);
    }

    public boolean withinLimit(long bytesLimit) {
        return stats.finalSize() <= bytesLimit;
    }

    /**
     * Name to archive the artifact under: the original name, with a .jpg
     * extension when the bytes were re-encoded.
     */
    public String archivedFilename(String originalName) {
        if (!compressed()) {
            return originalName;
        }
        String ext = MediaKind.extensionOf(originalName);
        String stem = ext.isEmpty() ? originalName : originalName.substring(0, originalName.length() - ext.length() - 1);
        return stem + ".jpg";
    }
}
