package com.cdnarchiver.channel.routing;

import com.cdnarchiver.common.errors.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the declarative route table once at start-up.
 *
 * <pre>
 * routes:
 *   images:
 *     public: { channel_id: "123", thread_id: "456" }
 * per_tenant_overrides:
 *   acme:
 *     images:
 *       public: { channel_id: "789" }
 * </pre>
 *
 * The YAML mapper also accepts the equivalent JSON document.
 */
@Slf4j
public final class RouteTableLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RouteTableLoader() {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RouteEntry {
        @JsonProperty("channel_id")
        private String channelId;
        @JsonProperty("thread_id")
        private String threadId;
        @JsonProperty("guild_id")
        private String guildId;
        @JsonProperty("webhook_url")
        private String webhookUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RouteDocument {
        private Map<String, Map<String, RouteEntry>> routes;
        @JsonProperty("per_tenant_overrides")
        private Map<String, Map<String, Map<String, RouteEntry>>> perTenantOverrides;
    }

    /**
     * Load and validate a route table file.
     *
     * @throws ConfigurationException if the file is missing, unparsable, or an
     *                                entry lacks a channel id
     */
    public static RouteTable load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Route table not found: " + path);
        }
        RouteDocument doc;
        try {
            doc = MAPPER.readValue(Files.readAllBytes(path), RouteDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Route table unreadable: " + path + ": " + e.getMessage(), e);
        }
        if (doc == null || doc.getRoutes() == null) {
            throw new ConfigurationException("Route table has no 'routes' section: " + path);
        }

        Map<String, Map<String, RouteDecision>> routes = convert(doc.getRoutes(), "routes");
        Map<String, Map<String, Map<String, RouteDecision>>> overrides = new LinkedHashMap<>();
        if (doc.getPerTenantOverrides() != null) {
            doc.getPerTenantOverrides().forEach((tenant, table) -> overrides.put(tenant,
                    convert(table, "per_tenant_overrides." + tenant)));
        }
        RouteTable table = new RouteTable(routes, overrides);
        log.info("Loaded route table from {} ({} routes, {} tenant overrides)",
                path, table.size(), overrides.size());
        return table;
    }

    private static Map<String, Map<String, RouteDecision>> convert(
            Map<String, Map<String, RouteEntry>> source, String location) {
        Map<String, Map<String, RouteDecision>> result = new LinkedHashMap<>();
        if (source == null) {
            return result;
        }
        source.forEach((kind, byVisibility) -> {
            Map<String, RouteDecision> converted = new LinkedHashMap<>();
            if (byVisibility != null) {
                byVisibility.forEach((visibility, entry) -> {
                    if (entry == null || entry.getChannelId() == null || entry.getChannelId().isBlank()) {
                        throw new ConfigurationException(
                                "Route " + location + "." + kind + "." + visibility + " has no channel_id");
                    }
                    converted.put(visibility, new RouteDecision(entry.getChannelId().trim(),
                            blankToNull(entry.getThreadId()), blankToNull(entry.getGuildId()),
                            blankToNull(entry.getWebhookUrl())));
                });
            }
            result.put(kind, converted);
        });
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
