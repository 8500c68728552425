package com.cdnarchiver.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Coarse media classification used for policy, routing and compression.
 * Each kind except {@link #BLOBS} owns an extension allowlist.
 */
public enum MediaKind {

    IMAGES("images", Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp", "tif", "tiff", "heic")),
    VIDEOS("videos", Set.of("mp4", "mov", "mkv", "webm", "avi", "m4v")),
    AUDIO("audio", Set.of("mp3", "wav", "ogg", "oga", "opus", "m4a", "flac", "aac")),
    DOCS("docs", Set.of("pdf", "txt", "md", "csv", "json", "doc", "docx", "odt", "rtf", "xlsx", "pptx")),
    BLOBS("blobs", Set.of());

    /** Executables and scripts; never archived whatever the kind. */
    public static final Set<String> DENIED_EXTENSIONS = Set.of(
            "exe", "dll", "msi", "com", "scr", "bat", "cmd", "ps1", "vbs", "js", "jar", "sh", "apk", "app");

    private final String label;
    private final Set<String> extensions;

    MediaKind(String label, Set<String> extensions) {
        this.label = label;
        this.extensions = extensions;
    }

    public String label() {
        return label;
    }

    /**
     * Classify by extension, defaulting to {@link #BLOBS}.
     */
    public static MediaKind fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    public static MediaKind fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return BLOBS;
        }
        String lower = extension.toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.extensions.contains(lower)) {
                return kind;
            }
        }
        return BLOBS;
    }

    /**
     * Parse a label such as "images"; null for unknown labels.
     */
    public static MediaKind fromLabel(String label) {
        if (label == null)
            return null;
        String lower = label.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.label.equals(lower)) {
                return kind;
            }
        }
        return null;
    }

    public static boolean isAllowedExtension(String extension) {
        return fromExtension(extension) != BLOBS;
    }

    public static boolean isDeniedExtension(String extension) {
        return extension != null && DENIED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Lower-cased extension without the dot, or "" when there is none.
     */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        return extensionOf(path.getFileName().toString());
    }

    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
