package com.cdnarchiver.core.archive;

import com.cdnarchiver.manifest.ArchiveRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * The stored record plus whether it already existed before this call.
 */
public record ArchiveResult(@JsonUnwrapped ArchiveRecord record, @JsonProperty("cache_hit") boolean cacheHit) {
}
