package com.cdnarchiver.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Credential redaction for log lines and exception messages.
 * Masks bot tokens, webhook secrets and bearer tokens.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    // -----------------------------------------------------------------------
    // Patterns; group 1 is always the secret part
    // -----------------------------------------------------------------------

    private static final List<Pattern> PATTERNS = List.of(
            // Webhook URL: .../webhooks/{id}/{token}
            Pattern.compile("/webhooks/\\d+/([A-Za-z0-9._\\-]+)", Pattern.CASE_INSENSITIVE),
            // Authorization headers
            Pattern.compile("Authorization\\s*[:=]\\s*(?:Bot|Bearer)\\s+([A-Za-z0-9._\\-+=]+)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:Bot|Bearer)\\s+([A-Za-z0-9._\\-+=]{18,})"),
            // Raw bot token: base64 user id . timestamp . hmac
            Pattern.compile("\\b([MNO][A-Za-z\\d_-]{23,27}\\.[A-Za-z\\d_-]{6}\\.[A-Za-z\\d_-]{27,40})\\b"),
            // ENV-style assignments
            Pattern.compile("\\b[A-Z0-9_]*(?:TOKEN|SECRET|WEBHOOK)\\b\\s*[=:]\\s*[\"']?([^\\s\"'\\\\]+)"));

    /**
     * Redact every credential-looking substring in the text.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String secret = matcher.group(1);
            String replacement = secret == null || secret.startsWith("***") || secret.contains("…")
                    ? fullMatch
                    : fullMatch.replace(secret, maskToken(secret));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
