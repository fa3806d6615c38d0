package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.util.StepName;

import java.util.Set;

/**
 * Executes one pipeline step. Handlers are re-entrant: a step that failed or was interrupted is run
 * again from scratch with the same inputs.
 *
 * @param <P> payload type declared by {@link StepName#payloadType()} for {@link #step()}.
 */
public interface StepHandler<P> {

    StepName step();

    /** Prior steps whose payloads this handler may read. */
    Set<StepName> inputs();

    P execute(StepContext context) throws Exception;
}
