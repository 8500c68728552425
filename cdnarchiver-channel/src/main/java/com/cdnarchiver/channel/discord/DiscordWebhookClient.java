package com.cdnarchiver.channel.discord;

import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback delivery: one multipart POST to a pre-provisioned webhook.
 * {@code wait=true} makes Discord return the created message.
 */
public class DiscordWebhookClient {

    private final DiscordHttp http;

    public DiscordWebhookClient(DiscordHttp http) {
        this.http = http;
    }

    public CompletableFuture<DiscordMessage> executeWithFile(String webhookUrl, String threadId, Path file,
            String filename) {
        HttpUrl parsed = webhookUrl != null ? HttpUrl.parse(webhookUrl) : null;
        if (parsed == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid webhook URL"));
        }
        HttpUrl.Builder url = parsed.newBuilder().addQueryParameter("wait", "true");
        if (threadId != null && !threadId.isBlank()) {
            url.addQueryParameter("thread_id", threadId);
        }
        RequestBody body;
        try {
            body = http.fileMessageBody(file, filename);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        Request request = new Request.Builder().url(url.build()).post(body).build();
        return http.call("webhook upload", request).thenApply(DiscordMessage::fromJson);
    }
}
