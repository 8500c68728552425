package com.cdnarchiver.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The parts of a Discord message object the archiver cares about.
 */
public record DiscordMessage(String id, String channelId, List<DiscordAttachment> attachments) {

    public DiscordMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    static DiscordMessage fromJson(JsonNode node) {
        List<DiscordAttachment> attachments = new ArrayList<>();
        for (JsonNode attachment : node.path("attachments")) {
            attachments.add(DiscordAttachment.fromJson(attachment));
        }
        return new DiscordMessage(node.path("id").asText(null), node.path("channel_id").asText(null), attachments);
    }
}
