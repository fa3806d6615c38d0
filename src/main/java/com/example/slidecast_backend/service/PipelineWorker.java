package com.example.slidecast_backend.service;

import com.example.slidecast_backend.config.WorkerProperties;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.example.slidecast_backend.service.pipeline.PipelineOutcome;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drains the task queue on a single thread: pop, run the pipeline, record the outcome, repeat.
 * Started and stopped with the application context; stopping waits for the current task.
 */
@Service
public class PipelineWorker implements SmartLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineWorker.class);

    private final TaskQueue taskQueue;
    private final PipelineOrchestrator orchestrator;
    private final StorageService storageService;
    private final WorkerProperties properties;
    private final TaskExecutor executor;

    private volatile boolean running;
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    public PipelineWorker(TaskQueue taskQueue,
                          PipelineOrchestrator orchestrator,
                          StorageService storageService,
                          WorkerProperties properties,
                          @Qualifier("pipelineWorkerExecutor") TaskExecutor executor) {
        this.taskQueue = taskQueue;
        this.orchestrator = orchestrator;
        this.storageService = storageService;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isEnabled();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopped = new CountDownLatch(1);
        executor.execute(this::loop);
    }

    @Override
    public void stop() {
        running = false;
        try {
            if (!stopped.await(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("WORKER did not stop within {}", properties.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void loop() {
        LOGGER.info("WORKER started pollTimeout={}", properties.getPollTimeout());
        try {
            while (running) {
                try {
                    pollOnce();
                } catch (Exception e) {
                    LOGGER.error("WORKER poll failed err={}", e.toString(), e);
                    pause();
                }
            }
        } finally {
            LOGGER.info("WORKER stopped");
            stopped.countDown();
        }
    }

    /**
     * Waits up to the poll timeout for one task and processes it.
     *
     * @return {@code true} when a task was taken from the queue.
     */
    public boolean pollOnce() {
        Optional<Task> next = taskQueue.getNextTask(properties.getPollTimeout());
        next.ifPresent(this::processTask);
        return next.isPresent();
    }

    public void processTask(Task dequeued) {
        String taskId = dequeued.getTaskId();
        try {
            Task task = taskQueue.getTask(taskId).orElse(null);
            if (task == null) {
                LOGGER.warn("WORKER task vanished taskId={}", taskId);
                return;
            }
            if (task.getStatus() == TaskStatus.CANCELLED || taskQueue.isTaskCancelled(taskId)) {
                LOGGER.info("WORKER skip cancelled taskId={}", taskId);
                return;
            }
            if (task.getStatus().isTerminal()) {
                LOGGER.info("WORKER skip finished taskId={} status={}", taskId, task.getStatus());
                return;
            }

            taskQueue.updateTaskStatus(taskId, TaskStatus.PROCESSING, null);
            if (task.getTaskType() != TaskType.PROCESS_PRESENTATION) {
                taskQueue.updateTaskStatus(taskId, TaskStatus.FAILED, "Unsupported task type: " + task.getTaskType());
                return;
            }
            String uploadId = task.uploadId();
            if (uploadId == null || uploadId.isBlank()) {
                LOGGER.warn("WORKER missing upload_id taskId={}", taskId);
                taskQueue.updateTaskStatus(taskId, TaskStatus.FAILED, "Missing upload_id");
                return;
            }
            if (!StepContext.isValidUploadId(uploadId)) {
                LOGGER.warn("WORKER invalid upload_id taskId={} uploadId={}", taskId, uploadId);
                taskQueue.updateTaskStatus(taskId, TaskStatus.FAILED, "Invalid upload_id");
                return;
            }

            LOGGER.info("WORKER run taskId={} uploadId={}", taskId, uploadId);
            PipelineOutcome outcome = orchestrator.run(uploadId, taskId,
                    PipelineConfig.fromKwargs(task.getKwargs()), sourceFile(task));

            switch (outcome.status()) {
                case COMPLETED -> taskQueue.updateTaskStatus(taskId, TaskStatus.COMPLETED, null);
                case FAILED -> taskQueue.updateTaskStatus(taskId, TaskStatus.FAILED,
                        outcome.failedStep() + ": " + outcome.message());
                case CANCELLED -> LOGGER.info("WORKER task cancelled taskId={} uploadId={}", taskId, uploadId);
            }
            LOGGER.info("WORKER done taskId={} outcome={}", taskId, outcome.status());
        } catch (Exception e) {
            LOGGER.error("WORKER task crashed taskId={} err={}", taskId, e.toString(), e);
            markFailed(taskId, e);
        }
    }

    private Path sourceFile(Task task) {
        Object raw = task.getKwargs().get(Task.FILE_PATH);
        if (raw == null || String.valueOf(raw).isBlank()) {
            return null;
        }
        String key = String.valueOf(raw);
        if (!storageService.existsInRaw(key)) {
            LOGGER.warn("WORKER source not in raw storage taskId={} key={}", task.getTaskId(), key);
        }
        return storageService.resolveRaw(key);
    }

    private void markFailed(String taskId, Exception e) {
        try {
            taskQueue.updateTaskStatus(taskId, TaskStatus.FAILED,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (RuntimeException inner) {
            LOGGER.error("WORKER could not mark task failed taskId={} err={}", taskId, inner.toString());
        }
    }

    private void pause() {
        try {
            Thread.sleep(properties.getPollTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
