package com.cdnarchiver.core.policy;

import com.cdnarchiver.common.config.ArchiverEnv;
import com.cdnarchiver.common.model.ArchiveMeta;
import com.cdnarchiver.media.MediaKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a file may be archived. Every failing check adds a reason;
 * nothing short-circuits.
 */
@Slf4j
public class PolicyEngine {

    private final ArchiverEnv env;
    private final ContentPolicy contentPolicy;

    public PolicyEngine(ArchiverEnv env, ContentPolicy contentPolicy) {
        this.env = env;
        this.contentPolicy = contentPolicy != null ? contentPolicy : ContentPolicy.ALLOW_ALL;
    }

    public PolicyEngine(ArchiverEnv env) {
        this(env, ContentPolicy.ALLOW_ALL);
    }

    public PolicyDecision check(Path path, ArchiveMeta meta) {
        ArchiveMeta effective = meta != null ? meta : ArchiveMeta.empty();
        List<String> reasons = new ArrayList<>();

        if (effective.isDoNotArchive()) {
            reasons.add("do_not_archive is set");
        }

        String ext = MediaKind.extensionOf(displayName(path, effective));
        if (MediaKind.isDeniedExtension(ext)) {
            reasons.add("file extension ." + ext + " is not allowed");
        } else if (!MediaKind.isAllowedExtension(ext)) {
            reasons.add(ext.isEmpty() ? "unknown file type: no extension" : "unknown file type: ." + ext);
        }

        PolicyDecision delegated = contentPolicy.evaluate(path, effective);
        if (!delegated.allowed()) {
            reasons.addAll(delegated.reasons());
        }

        long limit = effective.getSizeLimit() != null && effective.getSizeLimit() > 0
                ? effective.getSizeLimit()
                : env.policyMaxBytes();
        long size = sizeOf(path);
        if (size > limit) {
            reasons.add("file size " + size + " exceeds limit " + limit);
        }

        if (!reasons.isEmpty()) {
            log.debug("Policy denied {}: {}", path.getFileName(), reasons);
        }
        return PolicyDecision.fromReasons(reasons);
    }

    /**
     * The client's original filename when known, else the on-disk name.
     */
    static String displayName(Path path, ArchiveMeta meta) {
        String name = meta != null ? ArchiveMeta.baseName(meta.getFilename()) : null;
        return name != null ? name : path.getFileName().toString();
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + path, e);
        }
    }
}
