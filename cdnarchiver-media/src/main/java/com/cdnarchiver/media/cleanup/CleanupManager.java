package com.cdnarchiver.media.cleanup;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Removes local copies once their bytes are archived.
 * Deletion is idempotent; a file that is already gone is not an error.
 */
@Slf4j
public class CleanupManager {

    /**
     * Delete a file if present.
     *
     * @return true if a file was removed by this call
     */
    public boolean delete(Path path) {
        if (path == null) {
            return false;
        }
        try {
            boolean removed = Files.deleteIfExists(path);
            if (removed) {
                log.debug("Removed local copy {}", path);
            }
            return removed;
        } catch (IOException e) {
            log.warn("Failed to remove local copy {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Delete each path; distinct paths only, nulls ignored.
     */
    public void deleteAll(Path... paths) {
        Set<Path> distinct = new LinkedHashSet<>();
        for (Path path : paths) {
            if (path != null) {
                distinct.add(path);
            }
        }
        distinct.forEach(this::delete);
    }
}
