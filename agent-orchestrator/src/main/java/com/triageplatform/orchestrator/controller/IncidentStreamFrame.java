package com.triageplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.model.ExecutionResult;
import com.triageplatform.common.model.WorkerEvent;

/**
 * One line of the NDJSON triage stream: a worker lifecycle event, or the final result as the
 * last line. Exactly one of {@code event} / {@code result} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentStreamFrame(
    @JsonProperty("type")   String type,
    @JsonProperty("event")  WorkerEvent event,
    @JsonProperty("result") ExecutionResult result
) {
    public static final String WORKER_EVENT = "worker_event";
    public static final String RESULT       = "result";

    public static IncidentStreamFrame of(WorkerEvent event) {
        return new IncidentStreamFrame(WORKER_EVENT, event, null);
    }

    public static IncidentStreamFrame of(ExecutionResult result) {
        return new IncidentStreamFrame(RESULT, null, result);
    }
}
