package com.cdnarchiver.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Discord REST API constants and error helpers.
 */
public final class DiscordApi {

    private DiscordApi() {
    }

    public static final String API_BASE = "https://discord.com/api/v10";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // =========================================================================
    // Error type
    // =========================================================================

    public static class ApiError extends RuntimeException {
        private final int status;
        private final Double retryAfterSeconds;

        public ApiError(String message, int status, Double retryAfterSeconds) {
            super(message);
            this.status = status;
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getStatus() {
            return status;
        }

        public Double getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }

    // =========================================================================
    // Error text parsing
    // =========================================================================

    /**
     * Format a Discord API error JSON body into a human-readable message.
     * Uses "message" and optional "retry_after" from the payload.
     */
    public static String formatErrorText(String responseBody) {
        if (responseBody == null)
            return null;
        String trimmed = responseBody.trim();
        if (trimmed.isEmpty())
            return null;
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return trimmed;
        }
        JsonNode node = parseObject(trimmed);
        if (node == null) {
            return trimmed;
        }
        String message = node.path("message").asText("");
        String msg = !message.isEmpty() ? message : "unknown error";
        Double retryAfter = retryAfterSeconds(node);
        if (retryAfter != null) {
            String formatted = retryAfter < 10 ? String.format("%.1fs", retryAfter)
                    : Math.round(retryAfter) + "s";
            return msg + " (retry after " + formatted + ")";
        }
        return msg;
    }

    /**
     * Build an {@link ApiError} for a non-2xx response.
     */
    public static ApiError toApiError(String operation, int status, String responseBody) {
        String detail = formatErrorText(responseBody);
        JsonNode parsed = parseObject(responseBody);
        Double retryAfter = parsed != null ? retryAfterSeconds(parsed) : null;
        String message = "Discord " + operation + " failed: HTTP " + status
                + (detail != null ? " " + detail : "");
        return new ApiError(message, status, retryAfter);
    }

    /**
     * Check if an API error is rate-limited (HTTP 429).
     */
    public static boolean isRateLimited(Throwable err) {
        return err instanceof ApiError && ((ApiError) err).getStatus() == 429;
    }

    private static JsonNode parseObject(String body) {
        if (body == null || !body.trim().startsWith("{")) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            return null;
        }
    }

    private static Double retryAfterSeconds(JsonNode node) {
        JsonNode retry = node.get("retry_after");
        return retry != null && retry.isNumber() ? retry.asDouble() : null;
    }
}
