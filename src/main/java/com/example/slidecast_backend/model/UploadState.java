package com.example.slidecast_backend.model;

import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.UploadStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted progress of one upload through the pipeline. The key set of {@code steps} is fixed when the
 * state is created and keeps execution order.
 */
public class UploadState {
    private String uploadId;
    private String taskId;
    private UploadStatus status = UploadStatus.UPLOADED;
    private String currentStep;
    private LinkedHashMap<String, StepRecord> steps = new LinkedHashMap<>();
    private PipelineConfig config;
    private List<ErrorEntry> errors = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    public UploadState() {
    }

    public UploadState(String uploadId, PipelineConfig config) {
        this.uploadId = uploadId;
        this.config = config;
    }

    public Optional<StepRecord> step(StepName step) {
        return Optional.ofNullable(steps.get(step.key()));
    }

    public boolean hasStep(StepName step) {
        return steps.containsKey(step.key());
    }

    public String getUploadId() {
        return uploadId;
    }

    public void setUploadId(String uploadId) {
        this.uploadId = uploadId;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public UploadStatus getStatus() {
        return status;
    }

    public void setStatus(UploadStatus status) {
        this.status = status;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    public Map<String, StepRecord> getSteps() {
        return steps;
    }

    public void setSteps(Map<String, StepRecord> steps) {
        this.steps = steps == null ? new LinkedHashMap<>() : new LinkedHashMap<>(steps);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public void setConfig(PipelineConfig config) {
        this.config = config;
    }

    public List<ErrorEntry> getErrors() {
        return errors;
    }

    public void setErrors(List<ErrorEntry> errors) {
        this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
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
