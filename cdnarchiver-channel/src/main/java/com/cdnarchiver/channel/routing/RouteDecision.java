package com.cdnarchiver.channel.routing;

/**
 * Destination for one archive upload.
 *
 * @param channelId  channel that owns the stored message
 * @param threadId   optional thread inside the channel
 * @param guildId    optional guild, used as the size-limit target
 * @param webhookUrl optional webhook bound to this destination for fallback delivery
 */
public record RouteDecision(String channelId, String threadId, String guildId, String webhookUrl) {

    public RouteDecision(String channelId, String threadId) {
        this(channelId, threadId, null, null);
    }

    /** Channel the message is actually posted to. */
    public String deliveryChannelId() {
        return threadId != null && !threadId.isBlank() ? threadId : channelId;
    }

    /** Key for per-target upload limit overrides. */
    public String targetId() {
        return guildId != null && !guildId.isBlank() ? guildId : channelId;
    }
}
