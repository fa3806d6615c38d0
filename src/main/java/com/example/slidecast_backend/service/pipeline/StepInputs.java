package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.exception.StepValidationException;
import com.example.slidecast_backend.model.StepRecord;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed, read-only view of the payloads a handler declared as inputs. Only COMPLETED steps with data count.
 */
public final class StepInputs {
    private final Set<StepName> declared;
    private final Map<StepName, JsonNode> payloads;
    private final StepPayloadCodec codec;

    private StepInputs(Set<StepName> declared, Map<StepName, JsonNode> payloads, StepPayloadCodec codec) {
        this.declared = declared;
        this.payloads = payloads;
        this.codec = codec;
    }

    public static StepInputs from(UploadState state, Set<StepName> declared, StepPayloadCodec codec) {
        Map<StepName, JsonNode> payloads = new EnumMap<>(StepName.class);
        for (StepName step : declared) {
            state.step(step)
                    .filter(r -> r.getStatus() == StepStatus.COMPLETED && r.getData() != null && !r.getData().isNull())
                    .map(StepRecord::getData)
                    .ifPresent(data -> payloads.put(step, data));
        }
        return new StepInputs(Set.copyOf(declared), payloads, codec);
    }

    public <P> Optional<P> find(StepName step, Class<P> type) {
        if (!declared.contains(step)) {
            throw new IllegalArgumentException("Step " + step.key() + " is not a declared input");
        }
        JsonNode data = payloads.get(step);
        return data == null ? Optional.empty() : Optional.of(codec.decode(step, data, type));
    }

    public <P> P require(StepName step, Class<P> type) {
        return find(step, type).orElseThrow(() ->
                new StepValidationException("No data from step " + step.key()));
    }
}
