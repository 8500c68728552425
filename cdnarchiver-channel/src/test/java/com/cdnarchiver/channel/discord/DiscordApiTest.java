package com.cdnarchiver.channel.discord;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordApiTest {

    @Test
    void formatsMessageAndRetryAfter() {
        assertEquals("You are being rate limited. (retry after 1.5s)",
                DiscordApi.formatErrorText("{\"message\":\"You are being rate limited.\",\"retry_after\":1.5}"));
        assertEquals("Missing Access", DiscordApi.formatErrorText("{\"message\":\"Missing Access\",\"code\":50001}"));
        assertEquals("Bad Gateway", DiscordApi.formatErrorText("Bad Gateway"));
        assertNull(DiscordApi.formatErrorText("  "));
    }

    @Test
    void apiErrorCarriesStatusAndRetryAfter() {
        DiscordApi.ApiError error = DiscordApi.toApiError("upload", 429,
                "{\"message\":\"slow down\",\"retry_after\":12}");
        assertEquals(429, error.getStatus());
        assertEquals(12.0, error.getRetryAfterSeconds());
        assertEquals("Discord upload failed: HTTP 429 slow down (retry after 12s)", error.getMessage());
        assertTrue(DiscordApi.isRateLimited(error));
        assertFalse(DiscordApi.isRateLimited(DiscordApi.toApiError("upload", 413, "")));
    }

    @Test
    void tokenNormalization() {
        assertEquals("abc.def", DiscordToken.normalize("  Bot abc.def "));
        assertEquals("Bot abc.def", DiscordToken.authorizationHeader("abc.def"));
        assertNull(DiscordToken.normalize("Bot   "));
        assertNull(DiscordToken.normalize("bot"));
        assertEquals("Botanist.token", DiscordToken.normalize("Botanist.token"));
    }
}
