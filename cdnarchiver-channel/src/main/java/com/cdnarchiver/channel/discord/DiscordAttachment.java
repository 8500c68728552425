package com.cdnarchiver.channel.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One attachment of a stored message. {@code url} is a signed CDN link that expires.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordAttachment(
        String id,
        String url,
        @JsonProperty("proxy_url") String proxyUrl,
        String filename,
        long size,
        @JsonProperty("content_type") String contentType) {

    static DiscordAttachment fromJson(JsonNode node) {
        return new DiscordAttachment(
                node.path("id").asText(null),
                node.path("url").asText(null),
                node.path("proxy_url").asText(null),
                node.path("filename").asText(null),
                node.path("size").asLong(0),
                node.path("content_type").asText(null));
    }
}
