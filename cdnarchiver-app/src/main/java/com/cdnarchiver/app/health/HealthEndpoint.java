package com.cdnarchiver.app.health;

import com.cdnarchiver.common.errors.ManifestStoreException;
import com.cdnarchiver.common.infra.ErrorUtils;
import com.cdnarchiver.core.archive.ArchiveService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness plus a manifest reachability probe.
 */
@Slf4j
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper;
    private final ArchiveService archiveService;

    public HealthEndpoint(ObjectMapper mapper, ArchiveService archiveService) {
        this.mapper = mapper;
        this.archiveService = archiveService;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        node.put("archiver_enabled", archiveService.isEnabled());

        ObjectNode manifest = node.putObject("manifest");
        boolean reachable;
        try {
            manifest.put("records", archiveService.archivedCount());
            reachable = true;
        } catch (ManifestStoreException e) {
            log.warn("Health probe: manifest unreachable: {}", ErrorUtils.formatErrorMessage(e));
            manifest.put("error", ErrorUtils.formatErrorMessage(e));
            reachable = false;
        }
        manifest.put("reachable", reachable);
        node.put("status", reachable ? "ok" : "degraded");
        return node;
    }
}
