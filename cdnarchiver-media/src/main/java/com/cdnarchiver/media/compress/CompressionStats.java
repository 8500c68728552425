package com.cdnarchiver.media.compress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Size accounting for one fit-to-limit pass.
 *
 * @param originalSize bytes before re-encoding
 * @param finalSize    bytes of the artifact that will be uploaded
 * @param quality      JPEG quality of the final re-encode, null when passed through
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompressionStats(
        @JsonProperty("original_size") long originalSize,
        @JsonProperty("final_size") long finalSize,
        @JsonProperty("quality") Integer quality) {

    public static CompressionStats unchanged(long size) {
        return new CompressionStats(size, size, null);
    }
}
