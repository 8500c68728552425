package com.cdnarchiver.channel.discord;

/**
 * Discord bot token normalization.
 */
public final class DiscordToken {

    private DiscordToken() {
    }

    /**
     * Normalize a Discord bot token: trim, strip leading "Bot " prefix.
     *
     * @return the bare token, or null when blank
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String trimmed = raw.trim();
        String bare = trimmed.replaceFirst("(?i)^Bot(?:\\s+|$)", "");
        return bare.isBlank() ? null : bare;
    }

    /** Value for the Authorization header. */
    public static String authorizationHeader(String token) {
        return "Bot " + normalize(token);
    }
}
