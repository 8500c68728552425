package com.cdnarchiver.channel.discord;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Short-lived, single-purpose bot client: authenticate, do one thing, close.
 * A closed session refuses further calls.
 */
@Slf4j
public class DiscordBotSession implements AutoCloseable {

    private final DiscordHttp http;
    private final String token;
    private final String botUserId;
    private volatile boolean closed;

    private DiscordBotSession(DiscordHttp http, String token, String botUserId) {
        this.http = http;
        this.token = token;
        this.botUserId = botUserId;
    }

    /**
     * Authenticate the token against {@code /users/@me} and return an open session.
     */
    public static CompletableFuture<DiscordBotSession> open(DiscordHttp http, String rawToken) {
        String token = DiscordToken.normalize(rawToken);
        if (token == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Discord bot token is empty"));
        }
        Request request = new Request.Builder()
                .url(http.getApiBase() + "/users/@me")
                .header("Authorization", DiscordToken.authorizationHeader(token))
                .get()
                .build();
        return http.call("authenticate", request).thenApply(me -> {
            String userId = me.path("id").asText(null);
            log.debug("Bot session opened for user {}", userId);
            return new DiscordBotSession(http, token, userId);
        });
    }

    /**
     * Post one file as a new message in the channel (or thread).
     */
    public CompletableFuture<DiscordMessage> sendFile(String channelId, Path file, String filename) {
        ensureOpen();
        RequestBody body;
        try {
            body = http.fileMessageBody(file, filename);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        Request request = new Request.Builder()
                .url(http.getApiBase() + "/channels/" + channelId + "/messages")
                .header("Authorization", DiscordToken.authorizationHeader(token))
                .post(body)
                .build();
        return http.call("upload", request).thenApply(DiscordMessage::fromJson);
    }

    /**
     * Read a message back; attachment URLs in the result are freshly signed.
     */
    public CompletableFuture<DiscordMessage> fetchMessage(String channelId, String messageId) {
        ensureOpen();
        Request request = new Request.Builder()
                .url(http.getApiBase() + "/channels/" + channelId + "/messages/" + messageId)
                .header("Authorization", DiscordToken.authorizationHeader(token))
                .get()
                .build();
        return http.call("fetch message", request).thenApply(DiscordMessage::fromJson);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Bot session closed for user {}", botUserId);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Discord bot session already closed");
        }
    }
}
