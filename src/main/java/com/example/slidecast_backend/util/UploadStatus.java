package com.example.slidecast_backend.util;

/**
 * Lifecycle of an upload's pipeline, as stored in its state record.
 */
public enum UploadStatus {
    UPLOADED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
