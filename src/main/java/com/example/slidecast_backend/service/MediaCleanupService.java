package com.example.slidecast_backend.service;

import com.example.slidecast_backend.config.PipelineProperties;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import com.example.slidecast_backend.service.pipeline.StepContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Removes per-slide intermediate media once an upload has been composed. Final artifacts and the source
 * document are kept. Failures are logged only.
 */
@Service
public class MediaCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaCleanupService.class);

    private final StorageService storageService;
    private final PipelineProperties properties;

    public MediaCleanupService(StorageService storageService, PipelineProperties properties) {
        this.storageService = storageService;
        this.properties = properties;
    }

    /**
     * @return number of deleted files and directories.
     */
    public int cleanupIntermediates(String uploadId) {
        if (!properties.isDeleteIntermediatesOnSuccess()) {
            return 0;
        }
        Path root = storageService.rootOut();
        Path workDir;
        try {
            workDir = storageService.resolveOut(StepContext.workPrefix(uploadId));
        } catch (RuntimeException e) {
            LOGGER.warn("CLEANUP invalid uploadId={} err={}", uploadId, e.toString());
            return 0;
        }
        if (!Files.isDirectory(workDir)) {
            return 0;
        }

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(workDir)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            LOGGER.warn("CLEANUP listing failed uploadId={} dir={} err={}", uploadId, workDir, e.toString());
            return 0;
        }

        int deleted = 0;
        for (Path path : paths) {
            if (safeDelete(path)) {
                deleted++;
            }
        }
        deleteEmptyParents(workDir.getParent(), root);
        LOGGER.info("CLEANUP done uploadId={} deleted={}", uploadId, deleted);
        return deleted;
    }

    private void deleteEmptyParents(Path parent, Path root) {
        while (parent != null && root != null && !parent.equals(root) && parent.startsWith(root)) {
            if (!isDirectoryEmpty(parent)) {
                break;
            }
            safeDelete(parent);
            parent = parent.getParent();
        }
    }

    private boolean safeDelete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (Exception e) {
            LOGGER.warn("Cleanup delete failed path={} err={}", path, e.toString());
            return false;
        }
    }

    private boolean isDirectoryEmpty(Path dir) {
        try (var stream = Files.list(dir)) {
            return stream.findFirst().isEmpty();
        } catch (Exception e) {
            return false;
        }
    }
}
