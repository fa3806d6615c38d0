package com.example.slidecast_backend.service.Interfaces;

import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Persists one {@link UploadState} per upload id. Writes are whole-record read-modify-write; callers
 * must make sure only one writer touches an upload at a time.
 */
public interface StateStore {

    /**
     * Creates a fresh state with every step of {@code stepOrder} PENDING.
     *
     * @throws com.example.slidecast_backend.exception.StateConflictException when a state that is still
     *         UPLOADED or PROCESSING exists for the upload.
     */
    UploadState createState(String uploadId, String taskId, PipelineConfig config, List<StepName> stepOrder);

    Optional<UploadState> getState(String uploadId);

    void updateStepStatus(String uploadId, StepName step, StepStatus status, JsonNode data, String error);

    void markProcessing(String uploadId, String taskId);

    void markCompleted(String uploadId);

    void markFailed(String uploadId);

    void addError(String uploadId, String step, String message);
}
