package com.example.slidecast_backend.dto.web;

import com.example.slidecast_backend.model.Task;

import java.time.Instant;
import java.util.Map;

public record TaskView(
        String taskId,
        String taskType,
        String status,
        String uploadId,
        String ownerId,
        String error,
        Map<String, Object> kwargs,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskView of(Task task) {
        return new TaskView(
                task.getTaskId(),
                task.getTaskType() == null ? null : task.getTaskType().name(),
                task.getStatus().name(),
                task.uploadId(),
                task.getOwnerId(),
                task.getError(),
                task.getKwargs(),
                task.getCreatedAt(),
                task.getUpdatedAt());
    }
}
