package com.cdnarchiver.media.compress;

import com.cdnarchiver.common.errors.SizeLimitUncompressibleException;
import com.cdnarchiver.media.MediaKind;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Adaptive re-encoder that shrinks a file under a byte ceiling.
 *
 * <p>Only images can be re-encoded. The loop walks JPEG quality down from
 * {@value #START_QUALITY} in steps of {@value #QUALITY_STEP} and always stops
 * at {@value #QUALITY_FLOOR}, returning the floor result even when it is still
 * over the limit. Every other kind passes through when it already fits and
 * fails with {@link SizeLimitUncompressibleException} when it does not.
 */
@Slf4j
public class MediaCompressor {

    public static final int START_QUALITY = 85;
    public static final int QUALITY_STEP = 5;
    public static final int QUALITY_FLOOR = 35;

    private final Path workDir;

    public MediaCompressor(Path workDir) {
        this.workDir = workDir;
    }

    public MediaCompressor() {
        this(Path.of(System.getProperty("java.io.tmpdir"), "cdnarchiver"));
    }

    /**
     * Produce an artifact no larger than {@code bytesLimit} (best effort for images).
     */
    public FitResult fitToLimit(Path path, long bytesLimit, MediaKind kind) {
        long originalSize = sizeOf(path);
        if (originalSize <= bytesLimit) {
            return new FitResult(path, path, CompressionStats.unchanged(originalSize));
        }
        if (kind != MediaKind.IMAGES) {
            throw new SizeLimitUncompressibleException(kind.label(), originalSize, bytesLimit);
        }

        BufferedImage image = readImage(path);
        if (image == null) {
            log.debug("Image decoder unavailable for {}", path.getFileName());
            throw new SizeLimitUncompressibleException(kind.label(), originalSize, bytesLimit);
        }
        int orientation = ExifOrientation.read(path);
        if (orientation != ExifOrientation.NORMAL) {
            log.debug("Applying EXIF orientation {} to {}", orientation, path.getFileName());
        }
        BufferedImage rgb = ExifOrientation.apply(flatten(image), orientation);

        int quality = START_QUALITY;
        byte[] encoded;
        while (true) {
            encoded = encodeJpeg(rgb, quality);
            log.debug("Re-encoded {} at q={} -> {} bytes (limit {})",
                    path.getFileName(), quality, encoded.length, bytesLimit);
            if (encoded.length <= bytesLimit || quality <= QUALITY_FLOOR) {
                break;
            }
            quality -= QUALITY_STEP;
        }

        if (encoded.length > bytesLimit) {
            log.warn("Image {} still {} bytes at quality floor {} (limit {})",
                    path.getFileName(), encoded.length, QUALITY_FLOOR, bytesLimit);
        }

        Path output = writeOutput(path, quality, encoded);
        return new FitResult(path, output, new CompressionStats(originalSize, encoded.length, quality));
    }

    // ===== Internal helpers =====

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + path, e);
        }
    }

    private static BufferedImage readImage(Path path) {
        try {
            return ImageIO.read(path.toFile());
        } catch (IOException e) {
            log.debug("Failed to decode {}: {}", path.getFileName(), e.getMessage());
            return null;
        }
    }

    /** Drop alpha onto a white background; JPEG has no transparency. */
    private static BufferedImage flatten(BufferedImage img) {
        if (img.getType() == BufferedImage.TYPE_INT_RGB) {
            return img;
        }
        BufferedImage rgb = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, img.getWidth(), img.getHeight());
        g.drawImage(img, 0, 0, null);
        g.dispose();
        return rgb;
    }

    /** Encodes without any metadata, so EXIF never survives; orientation must already be applied. */
    public static byte[] encodeJpeg(BufferedImage img, int quality) {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality / 100.0f);
            writer.setOutput(out);
            writer.write(null, new IIOImage(img, null, null), param);
        } catch (IOException e) {
            throw new UncheckedIOException("JPEG encode failed", e);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }

    private Path writeOutput(Path source, int quality, byte[] encoded) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        try {
            Files.createDirectories(workDir);
            Path output = Files.createTempFile(workDir, stem + ".q" + quality + "-", ".jpg");
            Files.write(output, encoded);
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write compressed artifact for " + name, e);
        }
    }
}
