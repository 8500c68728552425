package com.cdnarchiver.channel.upload;

import com.cdnarchiver.channel.discord.DiscordToken;
import com.cdnarchiver.common.config.ArchiverEnv;

/**
 * Provider credentials for one call. {@code toString} never prints secrets.
 */
public record UploadCredentials(String botToken, String webhookUrl) {

    public static UploadCredentials fromEnv(ArchiverEnv env) {
        return new UploadCredentials(env.botToken(), env.webhookUrl());
    }

    public boolean hasBotToken() {
        return DiscordToken.normalize(botToken) != null;
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public String toString() {
        return "UploadCredentials[bot=" + hasBotToken() + ", webhook=" + hasWebhook() + "]";
    }
}
