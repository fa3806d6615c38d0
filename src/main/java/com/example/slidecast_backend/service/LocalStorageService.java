package com.example.slidecast_backend.service;

import com.example.slidecast_backend.exception.StorageException;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path rawDir;
    private final Path outDir;

    public LocalStorageService(Path baseDir, String rawPrefix, String outPrefix) {
        Path base = baseDir.toAbsolutePath().normalize();
        this.rawDir = base.resolve(rawPrefix).normalize();
        this.outDir = base.resolve(outPrefix).normalize();

        try {
            Files.createDirectories(rawDir);
            Files.createDirectories(outDir);
            LOGGER.info("LocalStorageService ready. base={}, raw={}, out={}", base, rawDir, outDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveRaw(String objectKey) {
        return safeResolve(rawDir, objectKey);
    }

    @Override
    public Path resolveOut(String objectKey) {
        return safeResolve(outDir, objectKey);
    }

    @Override
    public void uploadToOut(Path sourceFile, String objectKey) {
        Path target = safeResolve(outDir, objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(sourceFile, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed to " + target, e);
        }
    }

    @Override
    public void writeOut(String objectKey, byte[] content) {
        Path target = safeResolve(outDir, objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new StorageException("Write failed to " + target, e);
        }
    }

    @Override
    public boolean existsInRaw(String objectKey) {
        return Files.exists(safeResolve(rawDir, objectKey));
    }

    @Override
    public boolean existsInOut(String objectKey) {
        return Files.exists(safeResolve(outDir, objectKey));
    }

    @Override
    public long sizeInOut(String objectKey) {
        Path p = safeResolve(outDir, objectKey);
        try {
            return Files.size(p);
        } catch (IOException e) {
            throw new StorageException("Cannot stat " + p, e);
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    @Override public Path rootOut() { return outDir; }
}
