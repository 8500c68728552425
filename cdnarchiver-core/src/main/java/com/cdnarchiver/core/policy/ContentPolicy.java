package com.cdnarchiver.core.policy;

import com.cdnarchiver.common.model.ArchiveMeta;

import java.nio.file.Path;

/**
 * Pluggable content check consulted by {@link PolicyEngine}. A blocking
 * decision's reasons are reported to the caller verbatim.
 */
@FunctionalInterface
public interface ContentPolicy {

    ContentPolicy ALLOW_ALL = (path, meta) -> PolicyDecision.allow();

    PolicyDecision evaluate(Path path, ArchiveMeta meta);
}
