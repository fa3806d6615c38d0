package com.example.slidecast_backend.service.Interfaces;

import java.nio.file.Path;

/**
 * Object storage split in a raw area (uploaded source documents) and an out area (intermediate and
 * final media). Keys use forward slashes and are resolved below the area root.
 */
public interface StorageService {
    Path resolveRaw(String objectKey);

    Path resolveOut(String objectKey);

    void uploadToOut(Path sourceFile, String objectKey);

    /** Writes bytes to the out area, creating parent directories. */
    void writeOut(String objectKey, byte[] content);

    boolean existsInRaw(String objectKey);

    boolean existsInOut(String objectKey);

    long sizeInOut(String objectKey);

    Path rootOut();
}
