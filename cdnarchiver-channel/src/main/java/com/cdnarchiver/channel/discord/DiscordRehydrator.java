package com.cdnarchiver.channel.discord;

import com.cdnarchiver.channel.rehydrate.AttachmentRehydrator;
import com.cdnarchiver.channel.upload.UploadCredentials;
import com.cdnarchiver.common.errors.AttachmentNotFoundException;
import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;

/**
 * Re-reads the stored message with a bot session to obtain freshly signed
 * attachment URLs. Webhook-only deployments cannot rehydrate.
 */
@Slf4j
public class DiscordRehydrator implements AttachmentRehydrator {

    private final DiscordHttp http;

    public DiscordRehydrator(DiscordHttp http) {
        this.http = http;
    }

    @Override
    public DiscordAttachment fetchAttachment(String messageId, String channelId, UploadCredentials credentials,
            String attachmentId) {
        if (credentials == null || !credentials.hasBotToken()) {
            throw new ConfigurationException("Discord bot token is required to rehydrate attachments");
        }
        DiscordMessage message;
        try {
            message = DiscordBotSession.open(http, credentials.botToken())
                    .thenCompose(session -> session.fetchMessage(channelId, messageId)
                            .whenComplete((m, e) -> session.close()))
                    .join();
        } catch (CompletionException e) {
            Throwable cause = ErrorUtils.unwrap(e);
            if (cause instanceof DiscordApi.ApiError apiError && apiError.getStatus() == 404) {
                throw new AttachmentNotFoundException(messageId, attachmentId);
            }
            throw DiscordUploader.toUploadFailure(cause);
        }
        return pick(message, messageId, attachmentId);
    }

    static DiscordAttachment pick(DiscordMessage message, String messageId, String attachmentId) {
        if (message.attachments().isEmpty()) {
            throw new AttachmentNotFoundException(messageId, null);
        }
        if (attachmentId == null) {
            return message.attachments().get(0);
        }
        return message.attachments().stream()
                .filter(a -> attachmentId.equals(a.id()))
                .findFirst()
                .orElseThrow(() -> new AttachmentNotFoundException(messageId, attachmentId));
    }
}
