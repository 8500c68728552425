package com.cdnarchiver.core.archive;

import com.cdnarchiver.channel.discord.DiscordAttachment;
import com.cdnarchiver.channel.limits.UploadSizeLimits;
import com.cdnarchiver.channel.rehydrate.AttachmentRehydrator;
import com.cdnarchiver.channel.routing.ChannelRouter;
import com.cdnarchiver.channel.routing.RouteDecision;
import com.cdnarchiver.channel.upload.ArchiveUploader;
import com.cdnarchiver.channel.upload.UploadCredentials;
import com.cdnarchiver.channel.upload.UploadResult;
import com.cdnarchiver.common.config.ArchiverEnv;
import com.cdnarchiver.common.errors.ArchiveNotFoundException;
import com.cdnarchiver.common.errors.ArchiverDisabledException;
import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.errors.PolicyDeniedException;
import com.cdnarchiver.common.model.ArchiveMeta;
import com.cdnarchiver.core.policy.PolicyDecision;
import com.cdnarchiver.core.policy.PolicyEngine;
import com.cdnarchiver.manifest.ArchiveManifest;
import com.cdnarchiver.manifest.ArchiveRecord;
import com.cdnarchiver.manifest.ArchiveSummary;
import com.cdnarchiver.manifest.ContentHasher;
import com.cdnarchiver.manifest.RecordOutcome;
import com.cdnarchiver.media.MediaKind;
import com.cdnarchiver.media.cleanup.CleanupManager;
import com.cdnarchiver.media.compress.FitResult;
import com.cdnarchiver.media.compress.MediaCompressor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Archives files and turns stored hashes back into fresh download links.
 * <p>
 * {@link #archiveFile} runs a single pass with no retries:
 * <ol>
 *   <li>feature toggle</li>
 *   <li>policy</li>
 *   <li>route</li>
 *   <li>upload size limit for the route and delivery mode</li>
 *   <li>compression to fit that limit</li>
 *   <li>hash of the final artifact</li>
 *   <li>manifest lookup; a hit returns the stored record without uploading</li>
 *   <li>upload and insert-if-absent into the manifest</li>
 * </ol>
 * Steps 6 to 8 hold a per-hash lock, so concurrent callers with identical bytes
 * upload once. Local copies (original and any compressed intermediate) are
 * deleted after success; on failure only the intermediate is removed.
 */
@Slf4j
public class ArchiveService {

    private static final long REHYDRATE_CACHE_MAX_ENTRIES = 10_000;

    private final ArchiverEnv env;
    private final PolicyEngine policyEngine;
    private final ChannelRouter router;
    private final UploadSizeLimits sizeLimits;
    private final MediaCompressor compressor;
    private final ArchiveManifest manifest;
    private final ArchiveUploader uploader;
    private final AttachmentRehydrator rehydrator;
    private final CleanupManager cleanup;

    private final ContentLocks contentLocks = new ContentLocks();

    /** Fresh links keyed by content hash, kept well inside the provider's URL expiry. */
    private final Cache<String, RehydratedLink> linkCache;

    public ArchiveService(ArchiverEnv env, PolicyEngine policyEngine, ChannelRouter router,
            UploadSizeLimits sizeLimits, MediaCompressor compressor, ArchiveManifest manifest,
            ArchiveUploader uploader, AttachmentRehydrator rehydrator, CleanupManager cleanup) {
        this.env = env;
        this.policyEngine = policyEngine;
        this.router = router;
        this.sizeLimits = sizeLimits;
        this.compressor = compressor;
        this.manifest = manifest;
        this.uploader = uploader;
        this.rehydrator = rehydrator;
        this.cleanup = cleanup;
        this.linkCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(env.rehydrateCacheSeconds()))
                .maximumSize(REHYDRATE_CACHE_MAX_ENTRIES)
                .build();
    }

    // =========================================================================
    // Archive
    // =========================================================================

    public ArchiveResult archiveFile(Path path, ArchiveMeta meta) {
        ArchiveMeta effective = meta != null ? meta : ArchiveMeta.empty();

        if (!env.archiverEnabled()) {
            throw new ArchiverDisabledException();
        }

        PolicyDecision decision = policyEngine.check(path, effective);
        if (!decision.allowed()) {
            log.info("Archive of {} denied: {}", path.getFileName(), decision.reasons());
            throw new PolicyDeniedException(decision.reasons());
        }

        RouteDecision route = router.pickChannel(path, effective);
        UploadCredentials credentials = UploadCredentials.fromEnv(env);
        boolean useFallback = !credentials.hasBotToken() && env.webhookFallbackAllowed();

        long limit = sizeLimits.detect(route.targetId(), !useFallback);
        MediaKind kind = ChannelRouter.kindFor(path, effective);
        log.debug("Archiving {} as {} to channel {} (limit {} bytes, {})", path.getFileName(), kind.label(),
                route.deliveryChannelId(), limit, useFallback ? "webhook" : "bot");

        FitResult fit = compressor.fitToLimit(path, limit, kind);
        boolean succeeded = false;
        try {
            String hash = ContentHasher.computeHash(fit.outputPath());
            ArchiveResult result = contentLocks.withLock(hash,
                    () -> storeOrReuse(hash, fit, effective, kind, route, credentials, useFallback));
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                cleanup.deleteAll(path, fit.outputPath());
            } else if (fit.compressed()) {
                cleanup.delete(fit.outputPath());
            }
        }
    }

    private ArchiveResult storeOrReuse(String hash, FitResult fit, ArchiveMeta meta, MediaKind kind,
            RouteDecision route, UploadCredentials credentials, boolean useFallback) {
        ArchiveRecord existing = manifest.lookup(hash).orElse(null);
        if (existing != null) {
            log.info("Archive cache hit for {} (message {})", hash, existing.getMessageId());
            return new ArchiveResult(existing, true);
        }

        requireCredentials(route, credentials, useFallback);

        String filename = fit.archivedFilename(originalName(fit.source(), meta));
        UploadResult upload = uploader.upload(fit.outputPath(), filename, route, credentials, useFallback);

        ArchiveRecord candidate = ArchiveRecord.builder()
                .contentHash(hash)
                .messageId(upload.messageId())
                .channelId(upload.channelId())
                .attachmentIds(upload.attachmentIds())
                .filename(filename)
                .size(fit.stats().finalSize())
                .sha256(hash)
                .tenant(meta.getTenant())
                .workspace(meta.getWorkspace())
                .mediaType(kind.label())
                .visibility(meta.effectiveVisibility())
                .tags(ArchiveManifest.normalizeTags(meta.getTags()))
                .compression(fit.stats())
                .build();
        RecordOutcome outcome = manifest.record(candidate);
        if (!outcome.inserted()) {
            log.warn("Manifest already held {} after upload; message {} is a duplicate remote copy",
                    hash, upload.messageId());
        } else {
            log.info("Archived {} as {} ({} -> {} bytes)", filename, hash,
                    fit.stats().originalSize(), fit.stats().finalSize());
        }
        return new ArchiveResult(outcome.record(), !outcome.inserted());
    }

    private static void requireCredentials(RouteDecision route, UploadCredentials credentials, boolean useFallback) {
        if (useFallback) {
            if (route.webhookUrl() == null && !credentials.hasWebhook()) {
                throw new ConfigurationException("Webhook fallback enabled but no webhook URL is configured");
            }
        } else if (!credentials.hasBotToken()) {
            throw new ConfigurationException(
                    "No upload credentials: set " + ArchiverEnv.BOT_TOKEN + " or enable webhook fallback");
        }
    }

    private static String originalName(Path path, ArchiveMeta meta) {
        String name = ArchiveMeta.baseName(meta.getFilename());
        return name != null ? name : path.getFileName().toString();
    }

    // =========================================================================
    // Rehydrate
    // =========================================================================

    /**
     * @throws ArchiveNotFoundException if the hash was never archived
     */
    public RehydratedLink rehydrate(String contentHash) {
        return linkCache.get(contentHash, this::fetchLink);
    }

    private RehydratedLink fetchLink(String contentHash) {
        ArchiveRecord record = manifest.lookup(contentHash)
                .orElseThrow(() -> new ArchiveNotFoundException(contentHash));
        List<String> attachmentIds = record.getAttachmentIds();
        String attachmentId = attachmentIds == null || attachmentIds.isEmpty() ? null : attachmentIds.get(0);
        DiscordAttachment attachment = rehydrator.fetchAttachment(record.getMessageId(), record.getChannelId(),
                UploadCredentials.fromEnv(env), attachmentId);
        log.debug("Rehydrated {} from message {}", contentHash, record.getMessageId());
        String filename = record.getFilename() != null ? record.getFilename() : attachment.filename();
        return new RehydratedLink(attachment.url(), filename, contentHash);
    }

    // =========================================================================
    // Manifest queries
    // =========================================================================

    public List<ArchiveSummary> search(String tag, int limit, int offset) {
        return manifest.searchTag(tag, limit, offset);
    }

    /**
     * Replace the tags of an archived file.
     *
     * @throws ArchiveNotFoundException if the hash was never archived
     */
    public ArchiveRecord updateTags(String contentHash, Collection<String> tags) {
        return manifest.updateTags(contentHash, tags)
                .orElseThrow(() -> new ArchiveNotFoundException(contentHash));
    }

    public long archivedCount() {
        return manifest.count();
    }

    public boolean isEnabled() {
        return env.archiverEnabled();
    }
}
