package com.example.slidecast_backend.util;

/**
 * Lifecycle of a queued background job. Independent of the pipeline progress of the upload it refers to.
 */
public enum TaskStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
