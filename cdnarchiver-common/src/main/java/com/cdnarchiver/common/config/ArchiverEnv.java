package com.cdnarchiver.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Named archiver settings resolved through a pluggable lookup.
 * <p>
 * Nothing is cached: every accessor consults the lookup again, so a changed
 * environment or property source is picked up without a restart.
 */
public class ArchiverEnv {

    private static final Logger log = LoggerFactory.getLogger(ArchiverEnv.class);

    public static final String ENABLE_ARCHIVER = "ENABLE_DISCORD_ARCHIVER";
    public static final String ALLOW_WEBHOOK_FALLBACK = "ARCHIVER_ALLOW_WEBHOOK_FALLBACK";
    public static final String BOT_TOKEN = "DISCORD_BOT_TOKEN";
    public static final String WEBHOOK_URL = "DISCORD_WEBHOOK";
    public static final String API_BASE = "DISCORD_API_BASE";
    public static final String UPLOAD_LIMIT = "DISCORD_UPLOAD_LIMIT_BYTES";
    public static final String UPLOAD_LIMIT_WEBHOOK = "DISCORD_UPLOAD_LIMIT_WEBHOOK_BYTES";
    public static final String UPLOAD_LIMIT_GUILD_PREFIX = "DISCORD_UPLOAD_LIMIT_GUILD_";
    public static final String UPLOAD_LIMIT_WEBHOOK_GUILD_PREFIX = "DISCORD_UPLOAD_LIMIT_WEBHOOK_GUILD_";
    public static final String POLICY_MAX_BYTES = "ARCHIVER_POLICY_MAX_BYTES";
    public static final String BLOCKED_FILENAME_PATTERNS = "ARCHIVER_BLOCKED_FILENAME_PATTERNS";
    public static final String API_TOKEN = "ARCHIVE_API_TOKEN";
    public static final String DB_PATH = "ARCHIVE_DB_PATH";
    public static final String ROUTES_PATH = "ARCHIVE_ROUTES_PATH";
    public static final String REHYDRATE_CACHE_SECONDS = "ARCHIVER_REHYDRATE_CACHE_SECONDS";

    public static final String DEFAULT_API_BASE = "https://discord.com/api/v10";
    public static final String DEFAULT_DB_PATH = "./data/archive_manifest.db";
    public static final String DEFAULT_ROUTES_PATH = "./config/archive_routes.yaml";
    public static final long DEFAULT_POLICY_MAX_BYTES = 100L * 1024 * 1024;
    public static final long DEFAULT_REHYDRATE_CACHE_SECONDS = 600;

    private static final Set<String> TRUTHY_VALUES = Set.of("1", "true", "yes", "on");
    private static final Set<String> FALSY_VALUES = Set.of("0", "false", "no", "off");

    private final Function<String, String> lookup;

    public ArchiverEnv(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /** Settings backed by the process environment. */
    public static ArchiverEnv system() {
        return new ArchiverEnv(System::getenv);
    }

    /** Settings backed by a fixed map (tests, embedded callers). */
    public static ArchiverEnv of(Map<String, String> values) {
        return new ArchiverEnv(values::get);
    }

    // =========================================================================
    // Raw access
    // =========================================================================

    /**
     * Trimmed value for a key, or null when unset or blank.
     */
    public String get(String key) {
        String value = lookup.apply(key);
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Boolean parsed = parseBoolean(get(key));
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * Positive long for a key. Malformed or non-positive values are logged and
     * treated as unset.
     */
    public Long getPositiveLong(String key) {
        String raw = get(key);
        if (raw == null) {
            return null;
        }
        try {
            long value = Long.parseLong(raw);
            if (value > 0) {
                return value;
            }
            log.warn("env: ignoring non-positive {}={}", key, raw);
        } catch (NumberFormatException e) {
            log.warn("env: ignoring non-numeric {}={}", key, raw);
        }
        return null;
    }

    // =========================================================================
    // Typed settings
    // =========================================================================

    public boolean archiverEnabled() {
        return getBoolean(ENABLE_ARCHIVER, true);
    }

    public boolean webhookFallbackAllowed() {
        return getBoolean(ALLOW_WEBHOOK_FALLBACK, false);
    }

    public String botToken() {
        return get(BOT_TOKEN);
    }

    public String webhookUrl() {
        return get(WEBHOOK_URL);
    }

    public String apiBase() {
        String base = get(API_BASE, DEFAULT_API_BASE);
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    public String apiToken() {
        return get(API_TOKEN);
    }

    public long policyMaxBytes() {
        Long value = getPositiveLong(POLICY_MAX_BYTES);
        return value != null ? value : DEFAULT_POLICY_MAX_BYTES;
    }

    public List<String> blockedFilenamePatterns() {
        return splitCsv(get(BLOCKED_FILENAME_PATTERNS));
    }

    public Path manifestPath() {
        return Path.of(get(DB_PATH, DEFAULT_DB_PATH));
    }

    public Path routesPath() {
        return Path.of(get(ROUTES_PATH, DEFAULT_ROUTES_PATH));
    }

    public long rehydrateCacheSeconds() {
        Long value = getPositiveLong(REHYDRATE_CACHE_SECONDS);
        return value != null ? value : DEFAULT_REHYDRATE_CACHE_SECONDS;
    }

    // =========================================================================
    // Parsing helpers
    // =========================================================================

    /**
     * Parse a boolean value (true/false/null for unknown).
     */
    public static Boolean parseBoolean(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String lower = value.trim().toLowerCase();
        if (TRUTHY_VALUES.contains(lower))
            return true;
        if (FALSY_VALUES.contains(lower))
            return false;
        return null;
    }

    static List<String> splitCsv(String raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }
}
