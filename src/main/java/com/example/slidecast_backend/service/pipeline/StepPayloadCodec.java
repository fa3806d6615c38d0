package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.util.StepName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts step payloads to and from the JSON stored in the upload state, enforcing the payload type
 * each {@link StepName} declares.
 */
@Component
public class StepPayloadCodec {
    private final ObjectMapper objectMapper;

    public StepPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode encode(StepName step, Object payload) {
        if (payload == null) {
            throw new IllegalStateException("Step " + step.key() + " produced no payload");
        }
        if (!step.payloadType().isInstance(payload)) {
            throw new IllegalStateException("Step " + step.key() + " produced " + payload.getClass().getSimpleName()
                    + ", expected " + step.payloadType().getSimpleName());
        }
        return objectMapper.valueToTree(payload);
    }

    public <P> P decode(StepName step, JsonNode data, Class<P> type) {
        if (!step.payloadType().equals(type)) {
            throw new IllegalArgumentException("Step " + step.key() + " carries " + step.payloadType().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of step " + step.key() + " is unreadable", e);
        }
    }
}
