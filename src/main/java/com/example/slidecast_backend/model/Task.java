package com.example.slidecast_backend.model;

import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A submitted background job. {@code kwargs} is opaque to the queue; the worker reads the upload id and
 * pipeline options from it.
 */
public class Task {
    public static final String UPLOAD_ID = "upload_id";
    public static final String FILE_PATH = "file_path";

    private String taskId;
    private TaskType taskType;
    private TaskStatus status = TaskStatus.QUEUED;
    private Map<String, Object> kwargs = new LinkedHashMap<>();
    private String ownerId;
    private String error;
    private Instant createdAt;
    private Instant updatedAt;

    public Task() {
    }

    public Task(String taskId, TaskType taskType, Map<String, Object> kwargs) {
        this.taskId = taskId;
        this.taskType = taskType;
        setKwargs(kwargs);
    }

    public String uploadId() {
        Object value = kwargs.get(UPLOAD_ID);
        return value == null ? null : String.valueOf(value);
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public void setTaskType(TaskType taskType) {
        this.taskType = taskType;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public void setKwargs(Map<String, Object> kwargs) {
        this.kwargs = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
