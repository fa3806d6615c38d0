package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.exception.FanOutFailedException;

import java.util.List;

/**
 * Outcome of running one operation over many items. A partial result is a success.
 */
public record FanOutResult<R>(String label, int attempted, List<R> successes, List<Failure> failures) {

    public record Failure(String item, String message) {}

    public FanOutResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public boolean allFailed() {
        return attempted > 0 && successes.isEmpty();
    }

    /**
     * @throws FanOutFailedException when items were attempted and none succeeded.
     */
    public List<R> successesOrThrow() {
        if (allFailed()) {
            String first = failures.isEmpty() ? "" : " (first: " + failures.get(0).item() + ": " + failures.get(0).message() + ")";
            throw new FanOutFailedException(label + " failed for all " + attempted + " items" + first, attempted);
        }
        return successes;
    }
}
