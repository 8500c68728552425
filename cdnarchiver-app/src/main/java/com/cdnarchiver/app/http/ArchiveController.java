package com.cdnarchiver.app.http;

import com.cdnarchiver.common.config.ArchiverEnv;
import com.cdnarchiver.common.model.ArchiveMeta;
import com.cdnarchiver.core.archive.ArchiveResult;
import com.cdnarchiver.core.archive.ArchiveService;
import com.cdnarchiver.core.archive.RehydratedLink;
import com.cdnarchiver.manifest.ArchiveRecord;
import com.cdnarchiver.manifest.ArchiveSummary;
import com.cdnarchiver.media.MediaKind;
import com.cdnarchiver.media.cleanup.CleanupManager;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;

/**
 * HTTP façade over {@link ArchiveService}.
 * <p>
 * Writes require {@code Authorization: Bearer <ARCHIVE_API_TOKEN>}; with no
 * token configured every write is rejected.
 */
@Slf4j
@RestController
@RequestMapping("/archive")
public class ArchiveController {

    private final ArchiveService archiveService;
    private final ArchiverEnv env;
    private final CleanupManager cleanup;
    private final ObjectMapper objectMapper;

    public ArchiveController(ArchiveService archiveService, ArchiverEnv env, CleanupManager cleanup,
            ObjectMapper objectMapper) {
        this.archiveService = archiveService;
        this.env = env;
        this.cleanup = cleanup;
        this.objectMapper = objectMapper;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TagsRequest(List<String> tags) {
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> archive(
            @RequestPart("file") MultipartFile file,
            @RequestPart(value = "meta", required = false) String metaJson,
            HttpServletRequest request) {
        if (!authorized(request)) {
            return unauthorized();
        }
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiError.of("bad_request", "File part is empty", false));
        }
        ArchiveMeta meta;
        try {
            meta = metaJson == null || metaJson.isBlank()
                    ? ArchiveMeta.empty()
                    : objectMapper.readValue(metaJson, ArchiveMeta.class);
        } catch (JsonProcessingException e) {
            return ResponseEntity.badRequest()
                    .body(ApiError.of("bad_request", "Invalid meta JSON: " + e.getOriginalMessage(), false));
        }
        if (meta.getFilename() == null || meta.getFilename().isBlank()) {
            meta.setFilename(clientFilename(file));
        }

        Path staged = stage(file, meta.getFilename());
        try {
            ArchiveResult result = archiveService.archiveFile(staged, meta);
            return ResponseEntity.ok(result);
        } finally {
            cleanup.delete(staged);
        }
    }

    @GetMapping("/search")
    public List<ArchiveSummary> search(
            @RequestParam("tag") String tag,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return archiveService.search(tag, limit, offset);
    }

    @GetMapping("/{hash}")
    public RehydratedLink rehydrate(@PathVariable("hash") String hash) {
        return archiveService.rehydrate(hash);
    }

    @PatchMapping(value = "/{hash}/tags", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> updateTags(@PathVariable("hash") String hash, @RequestBody TagsRequest body,
            HttpServletRequest request) {
        if (!authorized(request)) {
            return unauthorized();
        }
        ArchiveRecord updated = archiveService.updateTags(hash, body.tags() == null ? List.of() : body.tags());
        return ResponseEntity.ok(updated);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private boolean authorized(HttpServletRequest request) {
        String expected = env.apiToken();
        String presented = extractBearerToken(request);
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    private static ResponseEntity<ApiError> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiError.of("unauthorized", "Missing or invalid bearer token", false));
    }

    private static String extractBearerToken(HttpServletRequest request) {
        String auth = request.getHeader("Authorization");
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring(7).trim();
        }
        return null;
    }

    /** Last path segment of the client-supplied name. */
    static String clientFilename(MultipartFile file) {
        String name = ArchiveMeta.baseName(file.getOriginalFilename());
        return name != null ? name : "upload";
    }

    private static Path stage(MultipartFile file, String filename) {
        String ext = MediaKind.extensionOf(filename);
        try {
            Path staged = Files.createTempFile("archive-upload-", ext.isEmpty() ? ".bin" : "." + ext);
            file.transferTo(staged);
            log.debug("Staged upload {} ({} bytes) at {}", filename, file.getSize(), staged);
            return staged;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stage upload " + filename, e);
        }
    }
}
