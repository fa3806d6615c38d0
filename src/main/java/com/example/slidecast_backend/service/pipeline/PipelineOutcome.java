package com.example.slidecast_backend.service.pipeline;

/**
 * Result of one orchestrator run.
 *
 * @param failedStep key of the failing step, only for {@link Status#FAILED}.
 */
public record PipelineOutcome(Status status, String failedStep, String message) {

    public enum Status { COMPLETED, FAILED, CANCELLED }

    public static PipelineOutcome completed() {
        return new PipelineOutcome(Status.COMPLETED, null, null);
    }

    public static PipelineOutcome failed(String step, String message) {
        return new PipelineOutcome(Status.FAILED, step, message);
    }

    public static PipelineOutcome cancelled() {
        return new PipelineOutcome(Status.CANCELLED, null, null);
    }
}
