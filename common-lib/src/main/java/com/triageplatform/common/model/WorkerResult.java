package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one worker for one invocation. {@code executionTimeMs} is overwritten by the
 * executor with its own wall-clock measurement.
 */
public record WorkerResult(
    @JsonProperty("workerName")      String workerName,
    @JsonProperty("hypotheses")      List<Hypothesis> hypotheses,
    @JsonProperty("executionTimeMs") double executionTimeMs
) {
    public WorkerResult {
        hypotheses = hypotheses == null ? List.of() : List.copyOf(hypotheses);
    }

    public static WorkerResult of(String workerName, List<Hypothesis> hypotheses) {
        return new WorkerResult(workerName, hypotheses, 0.0);
    }

    public WorkerResult withExecutionTimeMs(double elapsedMs) {
        return new WorkerResult(workerName, hypotheses, elapsedMs);
    }
}
