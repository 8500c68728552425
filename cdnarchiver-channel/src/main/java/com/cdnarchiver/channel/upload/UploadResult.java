package com.cdnarchiver.channel.upload;

import com.cdnarchiver.channel.discord.DiscordAttachment;

import java.util.List;

/**
 * Where the provider stored an uploaded file.
 */
public record UploadResult(String messageId, String channelId, List<DiscordAttachment> attachments) {

    public UploadResult {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public List<String> attachmentIds() {
        return attachments.stream().map(DiscordAttachment::id).toList();
    }
}
