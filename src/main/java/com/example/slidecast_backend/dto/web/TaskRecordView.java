package com.example.slidecast_backend.dto.web;

import com.example.slidecast_backend.model.TaskRecord;

import java.time.Instant;

public record TaskRecordView(
        String taskId,
        String uploadId,
        String taskType,
        String status,
        String ownerId,
        String error,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskRecordView of(TaskRecord record) {
        return new TaskRecordView(
                record.getId(),
                record.getUploadId(),
                record.getTaskType().name(),
                record.getStatus().name(),
                record.getOwnerId(),
                record.getError(),
                record.getCreatedAt(),
                record.getUpdatedAt());
    }
}
