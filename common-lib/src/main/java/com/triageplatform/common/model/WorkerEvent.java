package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single lifecycle event emitted by the executor. {@code timestampMs} is measured from the
 * start of the fan-out, not from the start of the worker.
 */
public record WorkerEvent(
    @JsonProperty("workerName")  String workerName,
    @JsonProperty("phase")       WorkerPhase phase,
    @JsonProperty("message")     String message,
    @JsonProperty("timestampMs") double timestampMs
) {
    public static WorkerEvent of(String workerName, WorkerPhase phase, String message, double timestampMs) {
        return new WorkerEvent(workerName, phase, message, timestampMs);
    }
}
