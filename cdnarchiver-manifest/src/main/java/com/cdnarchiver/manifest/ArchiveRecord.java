package com.cdnarchiver.manifest;

import com.cdnarchiver.media.compress.CompressionStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One manifest row: where the bytes for a content hash live and what they are.
 * Storage identifiers never change once written; only tags may be updated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveRecord {

    @JsonProperty("content_hash")
    private String contentHash;

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("channel_id")
    private String channelId;

    @Builder.Default
    @JsonProperty("attachment_ids")
    private List<String> attachmentIds = new ArrayList<>();

    private String filename;

    /** Bytes after compression. */
    private long size;

    /** Same value as {@link #contentHash}. */
    private String sha256;

    private String tenant;
    private String workspace;

    @JsonProperty("media_type")
    private String mediaType;

    private String visibility;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private CompressionStats compression;

    /** UTC, millisecond precision, e.g. {@code 2026-10-19T08:15:30.120Z}. */
    @JsonProperty("created_at")
    private String createdAt;
}
