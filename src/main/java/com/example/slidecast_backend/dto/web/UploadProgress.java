package com.example.slidecast_backend.dto.web;

import com.example.slidecast_backend.model.ErrorEntry;

import java.time.Instant;
import java.util.List;

/**
 * Progress snapshot of an upload.
 *
 * @param progress completed steps as a percentage of all non-skipped steps.
 */
public record UploadProgress(
        String uploadId,
        String taskId,
        String status,
        String currentStep,
        int progress,
        List<StepView> steps,
        List<ErrorEntry> errors,
        Instant createdAt,
        Instant updatedAt
) {
    public record StepView(String key, String name, String status, String error) {}
}
