package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.util.StepName;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes the handler beans by step. Exactly one handler per step; inputs must refer to other steps.
 */
@Component
public class StepHandlerRegistry {
    private final Map<StepName, StepHandler<?>> handlers = new EnumMap<>(StepName.class);

    public StepHandlerRegistry(List<StepHandler<?>> handlers) {
        for (StepHandler<?> handler : handlers) {
            if (handler.inputs().contains(handler.step())) {
                throw new IllegalStateException("Handler for " + handler.step().key() + " lists itself as input");
            }
            StepHandler<?> previous = this.handlers.put(handler.step(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for step " + handler.step().key() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
    }

    public StepHandler<?> handlerFor(StepName step) {
        StepHandler<?> handler = handlers.get(step);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for step " + step.key());
        }
        return handler;
    }
}
