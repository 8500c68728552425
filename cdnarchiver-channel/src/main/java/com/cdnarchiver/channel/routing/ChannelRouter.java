package com.cdnarchiver.channel.routing;

import com.cdnarchiver.common.errors.ConfigurationException;
import com.cdnarchiver.common.model.ArchiveMeta;
import com.cdnarchiver.media.MediaKind;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Picks the storage channel for a file from (kind, visibility, tenant).
 * A tenant override for the pair wins over the default entry.
 */
@Slf4j
public class ChannelRouter {

    private final RouteTable table;

    public ChannelRouter(RouteTable table) {
        this.table = table;
    }

    /**
     * @throws ConfigurationException if no route exists for the resolved pair
     */
    public RouteDecision pickChannel(Path path, ArchiveMeta meta, String tenant, String visibility) {
        String kind = kindFor(path, meta).label();
        String vis = visibility != null && !visibility.isBlank() ? visibility.trim() : ArchiveMeta.DEFAULT_VISIBILITY;

        var override = table.tenantRoute(tenant, kind, vis);
        if (override.isPresent()) {
            log.debug("Route {}/{} -> {} (tenant override {})", kind, vis, override.get().channelId(), tenant);
            return override.get();
        }
        return table.defaultRoute(kind, vis)
                .map(route -> {
                    log.debug("Route {}/{} -> {}", kind, vis, route.channelId());
                    return route;
                })
                .orElseThrow(() -> new ConfigurationException("No route configured for " + kind + "/" + vis));
    }

    public RouteDecision pickChannel(Path path, ArchiveMeta meta) {
        ArchiveMeta effective = meta != null ? meta : ArchiveMeta.empty();
        return pickChannel(path, effective, effective.getTenant(), effective.effectiveVisibility());
    }

    /**
     * Kind of the file: explicit {@code media_type}, else the original filename's
     * extension, else the on-disk name's extension.
     */
    public static MediaKind kindFor(Path path, ArchiveMeta meta) {
        if (meta != null) {
            MediaKind declared = MediaKind.fromLabel(meta.getMediaType());
            if (declared != null) {
                return declared;
            }
            if (meta.getFilename() != null && !meta.getFilename().isBlank()) {
                return MediaKind.fromExtension(MediaKind.extensionOf(meta.getFilename()));
            }
        }
        return kindFromPath(path);
    }

    public static MediaKind kindFromPath(Path path) {
        return MediaKind.fromPath(path);
    }
}
