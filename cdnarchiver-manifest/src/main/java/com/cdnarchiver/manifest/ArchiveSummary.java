package com.cdnarchiver.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Partial record returned by tag search.
 */
public record ArchiveSummary(
        @JsonProperty("content_hash") String contentHash,
        String filename,
        @JsonProperty("media_type") String mediaType,
        String visibility,
        Set<String> tags,
        long size,
        @JsonProperty("created_at") String createdAt) {
}
