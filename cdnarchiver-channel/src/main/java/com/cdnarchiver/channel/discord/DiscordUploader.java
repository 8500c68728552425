package com.cdnarchiver.channel.discord;

import com.cdnarchiver.channel.routing.RouteDecision;
import com.cdnarchiver.channel.upload.ArchiveUploader;
import com.cdnarchiver.channel.upload.UploadCredentials;
import com.cdnarchiver.channel.upload.UploadResult;
import com.cdnarchiver.common.errors.ArchiveException;
import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.errors.UploadFailureException;
import com.cdnarchiver.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Uploads through a per-call bot session, or through the webhook when
 * fallback delivery was selected.
 */
@Slf4j
public class DiscordUploader implements ArchiveUploader {

    private final DiscordHttp http;
    private final DiscordWebhookClient webhookClient;

    public DiscordUploader(DiscordHttp http) {
        this.http = http;
        this.webhookClient = new DiscordWebhookClient(http);
    }

    @Override
    public CompletableFuture<UploadResult> uploadAsync(Path path, String filename, RouteDecision destination,
            UploadCredentials credentials, boolean useFallback) {
        String name = filename != null ? filename : path.getFileName().toString();
        CompletableFuture<DiscordMessage> sent;
        if (useFallback) {
            String webhook = destination.webhookUrl() != null ? destination.webhookUrl() : credentials.webhookUrl();
            if (webhook == null || webhook.isBlank()) {
                return CompletableFuture.failedFuture(
                        new ConfigurationException("Webhook fallback selected but no webhook URL is configured"));
            }
            log.debug("Uploading {} via webhook (thread={})", name, destination.threadId());
            sent = webhookClient.executeWithFile(webhook, destination.threadId(), path, name);
        } else {
            if (!credentials.hasBotToken()) {
                return CompletableFuture.failedFuture(
                        new ConfigurationException("Discord bot token is not configured"));
            }
            String channelId = destination.deliveryChannelId();
            log.debug("Uploading {} via bot to channel {}", name, channelId);
            sent = DiscordBotSession.open(http, credentials.botToken())
                    .thenCompose(session -> session.sendFile(channelId, path, name)
                            .whenComplete((message, error) -> session.close()));
        }
        return sent.handle((message, error) -> {
            if (error != null) {
                throw new CompletionException(toUploadFailure(error));
            }
            return toResult(message, destination);
        });
    }

    private static UploadResult toResult(DiscordMessage message, RouteDecision destination) {
        if (message.id() == null || message.attachments().isEmpty()) {
            throw new CompletionException(
                    new UploadFailureException("Discord accepted the upload but returned no attachment"));
        }
        String channelId = message.channelId() != null ? message.channelId() : destination.deliveryChannelId();
        log.info("Uploaded {} as message {} in channel {}",
                message.attachments().get(0).filename(), message.id(), channelId);
        return new UploadResult(message.id(), channelId, message.attachments());
    }

    static ArchiveException toUploadFailure(Throwable error) {
        Throwable cause = ErrorUtils.unwrap(error);
        if (cause instanceof ArchiveException archiveException) {
            return archiveException;
        }
        Integer status = cause instanceof DiscordApi.ApiError apiError ? apiError.getStatus() : null;
        if (DiscordApi.isRateLimited(cause)) {
            log.warn("Discord rate limited the request, retry after {}s",
                    ((DiscordApi.ApiError) cause).getRetryAfterSeconds());
        }
        return new UploadFailureException(ErrorUtils.formatErrorMessage(cause), status, cause);
    }
}
