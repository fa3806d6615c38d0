package com.example.slidecast_backend.model;

import com.example.slidecast_backend.util.StepStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Status and output of one pipeline step. {@code data} holds the step's payload as stored JSON;
 * {@link com.example.slidecast_backend.service.pipeline.StepPayloadCodec} converts it to the step's payload type.
 */
public class StepRecord {
    private StepStatus status = StepStatus.PENDING;
    private JsonNode data;
    private String error;
    private Instant updatedAt;

    public StepRecord() {
    }

    public StepRecord(StepStatus status) {
        this.status = status;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = status;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
