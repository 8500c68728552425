package com.cdnarchiver.channel.rehydrate;

import com.cdnarchiver.channel.discord.DiscordAttachment;
import com.cdnarchiver.channel.upload.UploadCredentials;

/**
 * Rebuilds a fresh, signed download link from stable message identifiers.
 */
public interface AttachmentRehydrator {

    /**
     * @param attachmentId attachment to return; null for the first one
     * @throws com.cdnarchiver.common.errors.AttachmentNotFoundException if the
     *         requested attachment (or any attachment) is absent
     */
    DiscordAttachment fetchAttachment(String messageId, String channelId, UploadCredentials credentials,
            String attachmentId);
}
