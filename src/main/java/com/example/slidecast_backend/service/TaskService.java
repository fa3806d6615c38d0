package com.example.slidecast_backend.service;

import com.example.slidecast_backend.dto.web.SubmitTaskRequest;
import com.example.slidecast_backend.dto.web.UploadProgress;
import com.example.slidecast_backend.model.StepRecord;
import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.model.TaskRecord;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.repository.TaskRecordRepository;
import com.example.slidecast_backend.service.Interfaces.StateStore;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.example.slidecast_backend.util.TaskType;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-facing task operations on top of the queue, the state store and the audit table.
 */
@Service
public class TaskService {
    static final int MAX_LIST_SIZE = 200;

    private final TaskQueue taskQueue;
    private final StateStore stateStore;
    private final TaskRecordRepository taskRecordRepository;

    public TaskService(TaskQueue taskQueue, StateStore stateStore, TaskRecordRepository taskRecordRepository) {
        this.taskQueue = taskQueue;
        this.stateStore = stateStore;
        this.taskRecordRepository = taskRecordRepository;
    }

    public String submit(SubmitTaskRequest request) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put(Task.UPLOAD_ID, request.uploadId().trim());
        putIfPresent(kwargs, Task.FILE_PATH, request.filePath());
        putIfPresent(kwargs, "voice_language", request.voiceLanguage());
        putIfPresent(kwargs, "subtitle_language", request.subtitleLanguage());
        putIfPresent(kwargs, "generate_avatar", request.generateAvatar());
        putIfPresent(kwargs, "generate_subtitles", request.generateSubtitles());
        return taskQueue.submit(TaskType.PROCESS_PRESENTATION, kwargs, request.ownerId());
    }

    public Optional<Task> getTask(String taskId) {
        return taskQueue.getTask(taskId);
    }

    public boolean cancel(String taskId) {
        return taskQueue.cancelTask(taskId);
    }

    public boolean retry(String taskId) {
        return taskQueue.enqueueExistingTask(taskId);
    }

    public Optional<UploadProgress> getProgress(String uploadId) {
        return stateStore.getState(uploadId).map(TaskService::toProgress);
    }

    @Transactional(readOnly = true)
    public List<TaskRecord> listByOwner(String ownerId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIST_SIZE));
        return taskRecordRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public List<TaskRecord> listByUpload(String uploadId) {
        return taskRecordRepository.findByUploadIdOrderByCreatedAtDesc(uploadId);
    }

    /**
     * Completed steps as an integer percentage of the steps that are not skipped.
     */
    public static int percentComplete(UploadState state) {
        long counted = 0;
        long completed = 0;
        for (StepRecord record : state.getSteps().values()) {
            if (record.getStatus() == StepStatus.SKIPPED) {
                continue;
            }
            counted++;
            if (record.getStatus() == StepStatus.COMPLETED) {
                completed++;
            }
        }
        return counted == 0 ? 0 : (int) (completed * 100 / counted);
    }

    private static UploadProgress toProgress(UploadState state) {
        List<UploadProgress.StepView> steps = new ArrayList<>(state.getSteps().size());
        state.getSteps().forEach((key, record) -> steps.add(new UploadProgress.StepView(
                key,
                StepName.fromKey(key).map(StepName::displayName).orElse(key),
                record.getStatus().name(),
                record.getError())));
        return new UploadProgress(
                state.getUploadId(),
                state.getTaskId(),
                state.getStatus().name(),
                state.getCurrentStep(),
                percentComplete(state),
                steps,
                List.copyOf(state.getErrors()),
                state.getCreatedAt(),
                state.getUpdatedAt());
    }

    private static void putIfPresent(Map<String, Object> kwargs, String key, Object value) {
        if (value instanceof String s && s.isBlank()) {
            return;
        }
        if (value != null) {
            kwargs.put(key, value);
        }
    }
}
