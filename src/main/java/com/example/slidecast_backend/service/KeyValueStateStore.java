package com.example.slidecast_backend.service;

import com.example.slidecast_backend.config.PipelineProperties;
import com.example.slidecast_backend.exception.StateConflictException;
import com.example.slidecast_backend.model.ErrorEntry;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.StepRecord;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.service.Interfaces.KeyValueStore;
import com.example.slidecast_backend.service.Interfaces.StateStore;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.example.slidecast_backend.util.UploadStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link StateStore} that keeps each upload as one JSON document under {@code state:{uploadId}}.
 * Every write re-arms the retention TTL.
 */
public class KeyValueStateStore implements StateStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyValueStateStore.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final Clock clock;

    public KeyValueStateStore(KeyValueStore store, ObjectMapper objectMapper, PipelineProperties properties, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public UploadState createState(String uploadId, String taskId, PipelineConfig config, List<StepName> stepOrder) {
        Optional<UploadState> existing = getState(uploadId);
        if (existing.isPresent() && !existing.get().getStatus().isTerminal()) {
            throw new StateConflictException("Upload " + uploadId + " already has an active state (" + existing.get().getStatus() + ")");
        }
        Instant now = clock.instant();
        UploadState state = new UploadState(uploadId, config);
        state.setTaskId(taskId);
        state.setStatus(UploadStatus.UPLOADED);
        LinkedHashMap<String, StepRecord> steps = new LinkedHashMap<>();
        for (StepName step : stepOrder) {
            StepRecord record = new StepRecord(StepStatus.PENDING);
            record.setUpdatedAt(now);
            steps.put(step.key(), record);
        }
        state.setSteps(steps);
        state.setCreatedAt(now);
        state.setUpdatedAt(now);
        save(state);
        LOGGER.info("STATE CREATED uploadId={} taskId={} steps={}", uploadId, taskId, steps.keySet());
        return state;
    }

    @Override
    public Optional<UploadState> getState(String uploadId) {
        return store.get(stateKey(uploadId)).map(this::deserialize);
    }

    @Override
    public void updateStepStatus(String uploadId, StepName step, StepStatus status, JsonNode data, String error) {
        modify(uploadId, state -> {
            StepRecord record = state.getSteps().get(step.key());
            if (record == null) {
                LOGGER.warn("STATE step not in plan uploadId={} step={} status={}", uploadId, step.key(), status);
                return;
            }
            record.setStatus(status);
            if (data != null) {
                record.setData(data);
            }
            record.setError(error);
            record.setUpdatedAt(clock.instant());
            state.setCurrentStep(step.key());
        });
    }

    @Override
    public void markProcessing(String uploadId, String taskId) {
        modify(uploadId, state -> {
            state.setStatus(UploadStatus.PROCESSING);
            if (taskId != null) {
                state.setTaskId(taskId);
            }
        });
    }

    @Override
    public void markCompleted(String uploadId) {
        modify(uploadId, state -> state.setStatus(UploadStatus.COMPLETED));
    }

    @Override
    public void markFailed(String uploadId) {
        modify(uploadId, state -> state.setStatus(UploadStatus.FAILED));
    }

    @Override
    public void addError(String uploadId, String step, String message) {
        modify(uploadId, state -> state.getErrors().add(new ErrorEntry(step, message, clock.instant())));
    }

    private void modify(String uploadId, Consumer<UploadState> change) {
        Optional<UploadState> current = getState(uploadId);
        if (current.isEmpty()) {
            LOGGER.warn("STATE missing uploadId={} (expired or never created), write ignored", uploadId);
            return;
        }
        UploadState state = current.get();
        change.accept(state);
        state.setUpdatedAt(clock.instant());
        save(state);
    }

    private void save(UploadState state) {
        store.set(stateKey(state.getUploadId()), serialize(state), properties.getStateTtl());
    }

    private String stateKey(String uploadId) {
        return properties.key("state:" + uploadId);
    }

    private String serialize(UploadState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state for upload " + state.getUploadId(), e);
        }
    }

    private UploadState deserialize(String json) {
        try {
            return objectMapper.readValue(json, UploadState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read upload state", e);
        }
    }
}
