package com.cdnarchiver.core.archive;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A freshly signed download URL for an archived file.
 */
public record RehydratedLink(String url, String filename, @JsonProperty("content_hash") String contentHash) {
}
