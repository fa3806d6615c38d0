package com.example.slidecast_backend.util;

public enum StepStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    SKIPPED;

    /**
     * Steps in these states are not run again when a pipeline resumes.
     */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }
}
