package com.cdnarchiver.channel.limits;

import com.cdnarchiver.common.config.ArchiverEnv;

/**
 * Resolves the largest object the provider accepts for a target and delivery mode.
 *
 * <p>Most specific wins:
 * <ol>
 *   <li>per-target override for the mode ({@code DISCORD_UPLOAD_LIMIT_GUILD_<id>} for the bot,
 *       {@code DISCORD_UPLOAD_LIMIT_WEBHOOK_GUILD_<id>} for the webhook)</li>
 *   <li>webhook-mode global override (webhook mode only)</li>
 *   <li>global override</li>
 *   <li>{@link #DEFAULT_LIMIT_BYTES}</li>
 * </ol>
 * Overrides are read on every call.
 */
public class UploadSizeLimits {

    private static final long MB = 1024L * 1024;

    public static final long DEFAULT_LIMIT_BYTES = 10 * MB;

    private final ArchiverEnv env;

    public UploadSizeLimits(ArchiverEnv env) {
        this.env = env;
    }

    /**
     * @param targetId guild (or channel) the upload goes to, may be null
     * @param useBot   true for bot delivery, false for the webhook fallback
     * @return a positive byte ceiling
     */
    public long detect(String targetId, boolean useBot) {
        if (targetId != null && !targetId.isBlank()) {
            String prefix = useBot
                    ? ArchiverEnv.UPLOAD_LIMIT_GUILD_PREFIX
                    : ArchiverEnv.UPLOAD_LIMIT_WEBHOOK_GUILD_PREFIX;
            Long perTarget = env.getPositiveLong(prefix + targetId.trim());
            if (perTarget != null) {
                return perTarget;
            }
        }
        if (!useBot) {
            Long webhook = env.getPositiveLong(ArchiverEnv.UPLOAD_LIMIT_WEBHOOK);
            if (webhook != null) {
                return webhook;
            }
        }
        Long global = env.getPositiveLong(ArchiverEnv.UPLOAD_LIMIT);
        if (global != null) {
            return global;
        }
        return DEFAULT_LIMIT_BYTES;
    }

    public long detect() {
        return detect(null, true);
    }
}
