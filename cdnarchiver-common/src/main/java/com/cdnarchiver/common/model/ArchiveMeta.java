package com.cdnarchiver.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Caller-supplied metadata accompanying a file to archive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveMeta {

    public static final String DEFAULT_VISIBILITY = "public";

    private String tenant;
    private String workspace;

    /** Visibility tier used for routing (defaults to "public"). */
    private String visibility;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    /** Explicit kind ("images", "videos", ...) overriding extension detection. */
    @JsonProperty("media_type")
    private String mediaType;

    @JsonProperty("do_not_archive")
    private boolean doNotArchive;

    /** Per-call policy ceiling in bytes; null means the configured maximum. */
    @JsonProperty("size_limit")
    private Long sizeLimit;

    /** Original client filename, when the on-disk name is a temp name. */
    private String filename;

    public String effectiveVisibility() {
        return visibility != null && !visibility.isBlank() ? visibility.trim() : DEFAULT_VISIBILITY;
    }

    /**
     * Last segment of a client-supplied name, splitting on both '/' and '\\'.
     * Returns null when nothing usable is left.
     */
    public static String baseName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        String last = trimmed.substring(Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\')) + 1);
        return last.isBlank() ? null : last;
    }

    public static ArchiveMeta empty() {
        return new ArchiveMeta();
    }
}
