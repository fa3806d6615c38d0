package com.example.slidecast_backend.service.Interfaces;

import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * One shared FIFO of task ids plus a record per task. Delivery is at-least-once: a task id can be
 * popped by exactly one consumer, but nothing re-delivers it if that consumer dies.
 */
public interface TaskQueue {
    String CANCELLED_BY_USER = "Task was cancelled by user";

    String submit(TaskType taskType, Map<String, Object> kwargs, String ownerId);

    Optional<Task> getTask(String taskId);

    /** Blocks up to {@code timeout} for the next task id and returns its record. */
    Optional<Task> getNextTask(Duration timeout);

    /** @return {@code false} when the task is unknown. */
    boolean updateTaskStatus(String taskId, TaskStatus status, String error);

    /**
     * Cancels a QUEUED task (removed from the FIFO) or a PROCESSING task (marker written for the worker).
     *
     * @return {@code false} when the task is unknown or already finished.
     */
    boolean cancelTask(String taskId);

    boolean isTaskCancelled(String taskId);

    /**
     * Puts an existing, non-running task back on the FIFO as QUEUED.
     *
     * @return {@code false} when the task is unknown or PROCESSING.
     */
    boolean enqueueExistingTask(String taskId);

    void clearCancellationFlag(String taskId);

    long queueDepth();
}
