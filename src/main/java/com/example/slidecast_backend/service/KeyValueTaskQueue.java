package com.example.slidecast_backend.service;

import com.example.slidecast_backend.config.PipelineProperties;
import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.service.Interfaces.KeyValueStore;
import com.example.slidecast_backend.service.Interfaces.TaskMirror;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TaskQueue} on a {@link KeyValueStore}:
 * <ul>
 *     <li>{@code task:{id}} task record (JSON, no expiry)</li>
 *     <li>{@code task_queue} FIFO of task ids</li>
 *     <li>{@code task:{id}:cancelled} short-lived marker for tasks cancelled while running</li>
 * </ul>
 */
public class KeyValueTaskQueue implements TaskQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyValueTaskQueue.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final TaskMirror mirror;
    private final Clock clock;

    public KeyValueTaskQueue(KeyValueStore store, ObjectMapper objectMapper, PipelineProperties properties,
                             TaskMirror mirror, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.mirror = mirror;
        this.clock = clock;
    }

    @Override
    public String submit(TaskType taskType, Map<String, Object> kwargs, String ownerId) {
        String taskId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Task task = new Task(taskId, taskType, kwargs);
        task.setOwnerId(ownerId);
        task.setStatus(TaskStatus.QUEUED);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        save(task);
        store.pushTail(queueKey(), taskId);
        LOGGER.info("TASK SUBMIT taskId={} type={} uploadId={} ownerId={}", taskId, taskType, task.uploadId(), ownerId);
        return taskId;
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return Optional.empty();
        }
        return store.get(taskKey(taskId)).map(this::deserialize);
    }

    @Override
    public Optional<Task> getNextTask(Duration timeout) {
        Optional<String> taskId = store.popHead(queueKey(), timeout);
        if (taskId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Task> task = getTask(taskId.get());
        if (task.isEmpty()) {
            LOGGER.warn("TASK DEQUEUE orphan id taskId={} (record missing)", taskId.get());
        }
        return task;
    }

    @Override
    public boolean updateTaskStatus(String taskId, TaskStatus status, String error) {
        Optional<Task> current = getTask(taskId);
        if (current.isEmpty()) {
            LOGGER.warn("TASK STATUS unknown taskId={} status={}", taskId, status);
            return false;
        }
        Task task = current.get();
        task.setStatus(status);
        task.setError(error);
        task.setUpdatedAt(clock.instant());
        save(task);
        LOGGER.debug("TASK STATUS taskId={} status={}", taskId, status);
        return true;
    }

    @Override
    public boolean cancelTask(String taskId) {
        Optional<Task> current = getTask(taskId);
        if (current.isEmpty()) {
            return false;
        }
        Task task = current.get();
        switch (task.getStatus()) {
            case QUEUED -> {
                store.removeFromList(queueKey(), taskId);
                markCancelled(task);
                LOGGER.info("TASK CANCEL queued taskId={}", taskId);
                return true;
            }
            case PROCESSING -> {
                markCancelled(task);
                store.set(cancelledKey(taskId), "true", properties.getCancellationMarkerTtl());
                LOGGER.info("TASK CANCEL running taskId={} marker={}", taskId, properties.getCancellationMarkerTtl());
                return true;
            }
            default -> {
                LOGGER.info("TASK CANCEL refused taskId={} status={}", taskId, task.getStatus());
                return false;
            }
        }
    }

    @Override
    public boolean isTaskCancelled(String taskId) {
        if (store.exists(cancelledKey(taskId))) {
            return true;
        }
        return getTask(taskId).map(t -> t.getStatus() == TaskStatus.CANCELLED).orElse(false);
    }

    @Override
    public boolean enqueueExistingTask(String taskId) {
        Optional<Task> current = getTask(taskId);
        if (current.isEmpty()) {
            return false;
        }
        Task task = current.get();
        if (task.getStatus() == TaskStatus.PROCESSING) {
            LOGGER.info("TASK REQUEUE refused taskId={} status=PROCESSING", taskId);
            return false;
        }
        clearCancellationFlag(taskId);
        // a QUEUED task may still sit in the FIFO
        store.removeFromList(queueKey(), taskId);
        task.setStatus(TaskStatus.QUEUED);
        task.setError(null);
        task.setUpdatedAt(clock.instant());
        save(task);
        store.pushTail(queueKey(), taskId);
        LOGGER.info("TASK REQUEUE taskId={} uploadId={}", taskId, task.uploadId());
        return true;
    }

    @Override
    public void clearCancellationFlag(String taskId) {
        store.delete(cancelledKey(taskId));
    }

    @Override
    public long queueDepth() {
        return store.listSize(queueKey());
    }

    private void markCancelled(Task task) {
        task.setStatus(TaskStatus.CANCELLED);
        task.setError(CANCELLED_BY_USER);
        task.setUpdatedAt(clock.instant());
        save(task);
    }

    private void save(Task task) {
        store.set(taskKey(task.getTaskId()), serialize(task));
        try {
            mirror.record(task);
        } catch (RuntimeException e) {
            LOGGER.warn("TASK MIRROR failed taskId={} err={}", task.getTaskId(), e.toString());
        }
    }

    private String queueKey() {
        return properties.key("task_queue");
    }

    private String taskKey(String taskId) {
        return properties.key("task:" + taskId);
    }

    private String cancelledKey(String taskId) {
        return properties.key("task:" + taskId + ":cancelled");
    }

    private String serialize(Task task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.getTaskId(), e);
        }
    }

    private Task deserialize(String json) {
        try {
            return objectMapper.readValue(json, Task.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read task record", e);
        }
    }
}
