package com.cdnarchiver.media.compress;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * EXIF orientation (tag 0x0112) of a JPEG, and the pixel transform that bakes
 * it in. Re-encoding drops all metadata, so the rotation has to be applied to
 * the pixels first.
 */
@Slf4j
final class ExifOrientation {

    static final int NORMAL = 1;

    private static final int SOI = 0xFFD8;
    private static final int APP1 = 0xFFE1;
    private static final int SOS = 0xFFDA;
    private static final int EOI = 0xFFD9;
    private static final int TAG_ORIENTATION = 0x0112;
    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.ISO_8859_1);

    private ExifOrientation() {
    }

    /**
     * Orientation value 1..8; {@link #NORMAL} for non-JPEG input or when the tag is absent.
     */
    static int read(Path path) {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            if (in.readUnsignedShort() != SOI) {
                return NORMAL;
            }
            while (true) {
                int marker = in.readUnsignedShort();
                if ((marker & 0xFF00) != 0xFF00 || marker == SOS || marker == EOI) {
                    return NORMAL;
                }
                int length = in.readUnsignedShort() - 2;
                if (length < 0) {
                    return NORMAL;
                }
                byte[] segment = in.readNBytes(length);
                if (segment.length < length) {
                    return NORMAL;
                }
                if (marker == APP1) {
                    int orientation = fromExifSegment(segment);
                    if (orientation != 0) {
                        return orientation;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("No readable EXIF orientation in {}: {}", path.getFileName(), e.getMessage());
            return NORMAL;
        }
    }

    /** Orientation from an APP1 payload, 0 when it is not EXIF or carries no valid tag. */
    static int fromExifSegment(byte[] segment) {
        int tiff = EXIF_HEADER.length;
        if (segment.length < tiff + 8) {
            return 0;
        }
        for (int i = 0; i < EXIF_HEADER.length; i++) {
            if (segment[i] != EXIF_HEADER[i]) {
                return 0;
            }
        }
        ByteBuffer buf = ByteBuffer.wrap(segment);
        if (segment[tiff] == 'I' && segment[tiff + 1] == 'I') {
            buf.order(ByteOrder.LITTLE_ENDIAN);
        } else if (segment[tiff] == 'M' && segment[tiff + 1] == 'M') {
            buf.order(ByteOrder.BIG_ENDIAN);
        } else {
            return 0;
        }
        if ((buf.getShort(tiff + 2) & 0xFFFF) != 42) {
            return 0;
        }
        long ifdOffset = buf.getInt(tiff + 4) & 0xFFFFFFFFL;
        long ifd = tiff + ifdOffset;
        if (ifd + 2 > segment.length) {
            return 0;
        }
        int count = buf.getShort((int) ifd) & 0xFFFF;
        for (int i = 0; i < count; i++) {
            int entry = (int) ifd + 2 + i * 12;
            if (entry + 12 > segment.length) {
                break;
            }
            if ((buf.getShort(entry) & 0xFFFF) == TAG_ORIENTATION) {
                int value = buf.getShort(entry + 8) & 0xFFFF;
                return value >= 1 && value <= 8 ? value : 0;
            }
        }
        return 0;
    }

    /**
     * Apply an orientation to RGB pixels. Values 5..8 swap width and height.
     */
    static BufferedImage apply(BufferedImage img, int orientation) {
        if (orientation <= NORMAL || orientation > 8) {
            return img;
        }
        int w = img.getWidth();
        int h = img.getHeight();
        boolean swap = orientation >= 5;
        BufferedImage out = new BufferedImage(swap ? h : w, swap ? w : h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = img.getRGB(x, y);
                switch (orientation) {
                    case 2 -> out.setRGB(w - 1 - x, y, rgb);
                    case 3 -> out.setRGB(w - 1 - x, h - 1 - y, rgb);
                    case 4 -> out.setRGB(x, h - 1 - y, rgb);
                    case 5 -> out.setRGB(y, x, rgb);
                    case 6 -> out.setRGB(h - 1 - y, x, rgb);
                    case 7 -> out.setRGB(h - 1 - y, w - 1 - x, rgb);
                    default -> out.setRGB(y, w - 1 - x, rgb);
                }
            }
        }
        return out;
    }
}
