package com.example.slidecast_backend.service;

import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.StepRecord;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.service.Interfaces.StateStore;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.example.slidecast_backend.service.pipeline.CancellationToken;
import com.example.slidecast_backend.service.pipeline.PipelineOutcome;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.service.pipeline.StepHandlerRegistry;
import com.example.slidecast_backend.service.pipeline.StepInputs;
import com.example.slidecast_backend.service.pipeline.StepOrderPlanner;
import com.example.slidecast_backend.service.pipeline.StepPayloadCodec;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.example.slidecast_backend.util.UploadStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one upload through its ordered steps. Completed steps are never re-run, so calling
 * {@link #run} again after a failure or cancellation resumes at the first unfinished step.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StateStore stateStore;
    private final TaskQueue taskQueue;
    private final StepHandlerRegistry handlers;
    private final StepPayloadCodec codec;
    private final MediaCleanupService cleanupService;

    public PipelineOrchestrator(StateStore stateStore,
                                TaskQueue taskQueue,
                                StepHandlerRegistry handlers,
                                StepPayloadCodec codec,
                                MediaCleanupService cleanupService) {
        this.stateStore = stateStore;
        this.taskQueue = taskQueue;
        this.handlers = handlers;
        this.codec = codec;
        this.cleanupService = cleanupService;
    }

    /**
     * Runs (or resumes) the pipeline for an upload. Step failures are recorded in the upload state and
     * reported through the outcome, never thrown.
     *
     * @param taskId     task driving this run, used for cancellation checks; may be {@code null}.
     * @param config     requested options; ignored when the upload already has a state.
     * @param sourceFile uploaded document, {@code null} when only later steps remain.
     */
    public PipelineOutcome run(String uploadId, String taskId, PipelineConfig config, Path sourceFile) {
        CancellationToken cancellation = CancellationToken.forTask(taskQueue, taskId);
        if (cancellation.isCancelled()) {
            LOGGER.info("PIPELINE cancelled before start uploadId={} taskId={}", uploadId, taskId);
            stateStore.getState(uploadId)
                    .filter(s -> s.getStatus() != UploadStatus.COMPLETED)
                    .ifPresent(s -> stateStore.markFailed(uploadId));
            return PipelineOutcome.cancelled();
        }

        UploadState state = loadOrCreate(uploadId, taskId, config);
        List<StepName> order = stepsOf(state);
        stateStore.markProcessing(uploadId, taskId);
        LOGGER.info("PIPELINE START uploadId={} taskId={} steps={}", uploadId, taskId, order.size());

        for (StepName step : order) {
            if (cancellation.isCancelled()) {
                LOGGER.info("PIPELINE cancelled uploadId={} taskId={} before={}", uploadId, taskId, step.key());
                stateStore.markFailed(uploadId);
                return PipelineOutcome.cancelled();
            }

            Optional<UploadState> current = stateStore.getState(uploadId);
            if (current.isEmpty()) {
                LOGGER.error("PIPELINE state vanished uploadId={} step={}", uploadId, step.key());
                return PipelineOutcome.failed(step.key(), "Upload state expired during processing");
            }
            StepRecord record = current.get().step(step).orElse(null);
            if (record != null && record.getStatus().isDone()) {
                LOGGER.debug("STEP SKIP uploadId={} step={} status={}", uploadId, step.key(), record.getStatus());
                continue;
            }

            Optional<String> failure = runStep(current.get(), step, taskId, sourceFile);
            if (failure.isPresent()) {
                stateStore.markFailed(uploadId);
                return PipelineOutcome.failed(step.key(), failure.get());
            }
        }

        stateStore.markCompleted(uploadId);
        LOGGER.info("PIPELINE COMPLETED uploadId={} taskId={}", uploadId, taskId);
        try {
            cleanupService.cleanupIntermediates(uploadId);
        } catch (RuntimeException e) {
            LOGGER.warn("PIPELINE cleanup failed uploadId={} err={}", uploadId, e.toString());
        }
        return PipelineOutcome.completed();
    }

    /**
     * @return the failure message, empty when the step completed.
     */
    private Optional<String> runStep(UploadState state, StepName step, String taskId, Path sourceFile) {
        String uploadId = state.getUploadId();
        stateStore.updateStepStatus(uploadId, step, StepStatus.PROCESSING, null, null);
        LOGGER.info("STEP START uploadId={} step={}", uploadId, step.key());
        long t0 = System.nanoTime();
        try {
            StepHandler<?> handler = handlers.handlerFor(step);
            StepContext context = new StepContext(uploadId, taskId, state.getConfig(), sourceFile,
                    StepInputs.from(state, handler.inputs(), codec));
            Object payload = handler.execute(context);
            JsonNode data = codec.encode(step, payload);
            stateStore.updateStepStatus(uploadId, step, StepStatus.COMPLETED, data, null);
            LOGGER.info("STEP DONE uploadId={} step={} ms={}", uploadId, step.key(), (System.nanoTime() - t0) / 1_000_000);
            return Optional.empty();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = describe(e);
            LOGGER.warn("STEP FAILED uploadId={} step={} err={}", uploadId, step.key(), message, e);
            stateStore.updateStepStatus(uploadId, step, StepStatus.FAILED, null, message);
            stateStore.addError(uploadId, step.key(), message);
            return Optional.of(message);
        }
    }

    private UploadState loadOrCreate(String uploadId, String taskId, PipelineConfig requested) {
        Optional<UploadState> existing = stateStore.getState(uploadId);
        if (existing.isPresent()) {
            UploadState state = existing.get();
            if (requested != null && !requested.equals(state.getConfig())) {
                LOGGER.info("PIPELINE resume keeps stored config uploadId={} stored={} requested={}",
                        uploadId, state.getConfig(), requested);
            }
            return state;
        }
        PipelineConfig config = requested == null ? PipelineConfig.defaults() : requested;
        return stateStore.createState(uploadId, taskId, config, StepOrderPlanner.compute(config));
    }

    private static List<StepName> stepsOf(UploadState state) {
        List<StepName> order = new ArrayList<>(state.getSteps().size());
        for (String key : state.getSteps().keySet()) {
            StepName.fromKey(key).ifPresentOrElse(order::add,
                    () -> LOGGER.warn("PIPELINE unknown step key ignored uploadId={} key={}", state.getUploadId(), key));
        }
        return order;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
