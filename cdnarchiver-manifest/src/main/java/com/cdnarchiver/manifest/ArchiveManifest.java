package com.cdnarchiver.manifest;

import com.cdnarchiver.common.errors.ManifestStoreException;
import com.cdnarchiver.media.compress.CompressionStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable index from content hash to storage location, backed by a SQLite file.
 * <p>
 * Every call opens its own connection; SQLite's file locking (plus a busy
 * timeout) serializes conflicting writers across threads and processes.
 * Records are created with an atomic insert-if-absent and only their tags can
 * change afterwards.
 */
@Slf4j
public class ArchiveManifest {

    public static final int MAX_SEARCH_LIMIT = 100;
    static final int BUSY_TIMEOUT_MS = 5000;

    private static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String COLUMNS = "content_hash, message_id, channel_id, attachment_ids, filename, size, "
            + "sha256, tenant, workspace, media_type, visibility, tags, compression, created_at";

    private final Path dbPath;
    private final String jdbcUrl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ArchiveManifest(Path dbPath, ObjectMapper objectMapper, Clock clock) {
        this.dbPath = dbPath;
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;
        this.objectMapper = objectMapper;
        this.clock = clock;
        initSchema();
    }

    public ArchiveManifest(Path dbPath) {
        this(dbPath, new ObjectMapper(), Clock.systemUTC());
    }

    // =========================================================================
    // Schema
    // =========================================================================

    private void initSchema() {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ManifestStoreException("Cannot create manifest directory for " + dbPath, e);
        }
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS archive_manifest (
                        content_hash   TEXT PRIMARY KEY,
                        message_id     TEXT NOT NULL,
                        channel_id     TEXT NOT NULL,
                        attachment_ids TEXT NOT NULL,
                        filename       TEXT,
                        size           INTEGER NOT NULL,
                        sha256         TEXT,
                        tenant         TEXT,
                        workspace      TEXT,
                        media_type     TEXT,
                        visibility     TEXT,
                        tags           TEXT NOT NULL DEFAULT '',
                        compression    TEXT,
                        created_at     TEXT NOT NULL
                    )""");
            st.execute("CREATE INDEX IF NOT EXISTS idx_archive_manifest_created ON archive_manifest (created_at)");
        } catch (SQLException e) {
            throw new ManifestStoreException("Cannot initialize manifest at " + dbPath, e);
        }
        log.info("Archive manifest ready at {}", dbPath);
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    // =========================================================================
    // Reads
    // =========================================================================

    public Optional<ArchiveRecord> lookup(String contentHash) {
        if (contentHash == null || contentHash.isBlank()) {
            return Optional.empty();
        }
        try (Connection conn = connect()) {
            return select(conn, contentHash);
        } catch (SQLException e) {
            throw new ManifestStoreException("Manifest lookup failed for " + contentHash, e);
        }
    }

    /**
     * Substring match over the stored tag list, newest first.
     *
     * @param limit  clamped to 1..{@value #MAX_SEARCH_LIMIT}
     * @param offset negative values are treated as 0
     */
    public List<ArchiveSummary> searchTag(String substring, int limit, int offset) {
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT));
        int effectiveOffset = Math.max(0, offset);
        String pattern = "%" + escapeLike(substring == null ? "" : substring.trim()) + "%";
        String sql = "SELECT content_hash, filename, media_type, visibility, tags, size, created_at "
                + "FROM archive_manifest WHERE tags LIKE ? ESCAPE '\\' "
                + "ORDER BY created_at DESC, rowid DESC LIMIT ? OFFSET ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pattern);
            ps.setInt(2, effectiveLimit);
            ps.setInt(3, effectiveOffset);
            List<ArchiveSummary> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new ArchiveSummary(
                            rs.getString("content_hash"),
                            rs.getString("filename"),
                            rs.getString("media_type"),
                            rs.getString("visibility"),
                            decodeTags(rs.getString("tags")),
                            rs.getLong("size"),
                            rs.getString("created_at")));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new ManifestStoreException("Manifest search failed", e);
        }
    }

    public long count() {
        try (Connection conn = connect();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM archive_manifest")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new ManifestStoreException("Manifest count failed", e);
        }
    }

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Store the record unless one already exists for its hash. Either way the
     * returned outcome carries the row as stored; an existing row is never
     * replaced.
     */
    public RecordOutcome record(ArchiveRecord candidate) {
        if (candidate.getContentHash() == null || candidate.getContentHash().isBlank()) {
            throw new IllegalArgumentException("content_hash is required");
        }
        String createdAt = candidate.getCreatedAt() != null
                ? candidate.getCreatedAt()
                : CREATED_AT_FORMAT.format(clock.instant());
        String sql = "INSERT INTO archive_manifest (" + COLUMNS + ") "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT(content_hash) DO NOTHING";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                int inserted;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, candidate.getContentHash());
                    ps.setString(2, candidate.getMessageId());
                    ps.setString(3, candidate.getChannelId());
                    ps.setString(4, toJson(candidate.getAttachmentIds() == null
                            ? List.of() : candidate.getAttachmentIds()));
                    ps.setString(5, candidate.getFilename());
                    ps.setLong(6, candidate.getSize());
                    ps.setString(7, candidate.getSha256() != null
                            ? candidate.getSha256() : candidate.getContentHash());
                    ps.setString(8, candidate.getTenant());
                    ps.setString(9, candidate.getWorkspace());
                    ps.setString(10, candidate.getMediaType());
                    ps.setString(11, candidate.getVisibility());
                    ps.setString(12, encodeTags(candidate.getTags()));
                    ps.setString(13, candidate.getCompression() != null ? toJson(candidate.getCompression()) : null);
                    ps.setString(14, createdAt);
                    inserted = ps.executeUpdate();
                }
                ArchiveRecord stored = select(conn, candidate.getContentHash())
                        .orElseThrow(() -> new SQLException("Row vanished after insert"));
                conn.commit();
                if (inserted == 1) {
                    log.info("Manifest recorded {} -> message {} in channel {}",
                            stored.getContentHash(), stored.getMessageId(), stored.getChannelId());
                } else {
                    log.info("Manifest already holds {}; keeping existing row", stored.getContentHash());
                }
                return new RecordOutcome(stored, inserted == 1);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new ManifestStoreException("Manifest write failed for " + candidate.getContentHash(), e);
        }
    }

    /**
     * Replace the tag set of an existing record; nothing else changes.
     *
     * @return the updated record, or empty when the hash is unknown
     */
    public Optional<ArchiveRecord> updateTags(String contentHash, Collection<String> tags) {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE archive_manifest SET tags = ? WHERE content_hash = ?")) {
                    ps.setString(1, encodeTags(tags));
                    ps.setString(2, contentHash);
                    updated = ps.executeUpdate();
                }
                Optional<ArchiveRecord> result = updated == 0 ? Optional.empty() : select(conn, contentHash);
                conn.commit();
                if (updated > 0) {
                    log.info("Manifest tags updated for {}", contentHash);
                }
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new ManifestStoreException("Manifest tag update failed for " + contentHash, e);
        }
    }

    // =========================================================================
    // Row mapping
    // =========================================================================

    private Optional<ArchiveRecord> select(Connection conn, String contentHash) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM archive_manifest WHERE content_hash = ?")) {
            ps.setString(1, contentHash);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private ArchiveRecord mapRow(ResultSet rs) throws SQLException {
        String compression = rs.getString("compression");
        return ArchiveRecord.builder()
                .contentHash(rs.getString("content_hash"))
                .messageId(rs.getString("message_id"))
                .channelId(rs.getString("channel_id"))
                .attachmentIds(fromJson(rs.getString("attachment_ids"), STRING_LIST))
                .filename(rs.getString("filename"))
                .size(rs.getLong("size"))
                .sha256(rs.getString("sha256"))
                .tenant(rs.getString("tenant"))
                .workspace(rs.getString("workspace"))
                .mediaType(rs.getString("media_type"))
                .visibility(rs.getString("visibility"))
                .tags(decodeTags(rs.getString("tags")))
                .compression(compression != null ? fromJson(compression, CompressionStats.class) : null)
                .createdAt(rs.getString("created_at"))
                .build();
    }

    /**
     * Trim, drop blanks and split embedded commas so the comma-joined column
     * decodes back to the same set.
     */
    public static Set<String> normalizeTags(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) {
            return normalized;
        }
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            for (String part : tag.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    normalized.add(trimmed);
                }
            }
        }
        return normalized;
    }

    static String encodeTags(Collection<String> tags) {
        return String.join(",", normalizeTags(tags));
    }

    static Set<String> decodeTags(String raw) {
        return raw == null || raw.isEmpty() ? new LinkedHashSet<>() : normalizeTags(List.of(raw));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private String toJson(Object value) throws SQLException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot encode manifest column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot decode manifest column", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) throws SQLException {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot decode manifest column", e);
        }
    }
}
