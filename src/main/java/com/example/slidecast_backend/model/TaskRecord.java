package com.example.slidecast_backend.model;

import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
        name = "task_record",
        indexes = {
                @Index(name = "idx_task_record_owner_created", columnList = "owner_id, created_at"),
                @Index(name = "idx_task_record_upload_created", columnList = "upload_id, created_at")
        }
)
public class TaskRecord {
    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "upload_id", length = 128)
    private String uploadId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 32)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TaskStatus status = TaskStatus.QUEUED;

    @Column(name = "owner_id", length = 128)
    private String ownerId;

    @Column(name = "error", columnDefinition = "text")
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TaskRecord() {}

    public TaskRecord(String id, TaskType taskType) {
        this.id = id;
        this.taskType = taskType;
    }

    public static TaskRecord of(Task task) {
        TaskRecord record = new TaskRecord(task.getTaskId(), task.getTaskType());
        record.setUploadId(task.uploadId());
        record.setOwnerId(task.getOwnerId());
        record.setCreatedAt(task.getCreatedAt());
        record.copyStatus(task);
        return record;
    }

    public void copyStatus(Task task) {
        this.status = task.getStatus();
        this.error = task.getError();
        this.updatedAt = task.getUpdatedAt();
    }

    public String getId() {
        return id;
    }

    public String getUploadId() {
        return uploadId;
    }

    public void setUploadId(String uploadId) {
        this.uploadId = uploadId;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
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
