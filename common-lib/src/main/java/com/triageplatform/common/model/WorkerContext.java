package com.triageplatform.common.model;

import java.util.List;

/**
 * Read-only snapshot handed to every worker of one invocation: the extracted signals plus
 * the raw incident. Built once, after extraction and before dispatch.
 */
public record WorkerContext(List<Signal> signals, IncidentInput incident) {

    public WorkerContext {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static WorkerContext of(List<Signal> signals, IncidentInput incident) {
        return new WorkerContext(signals, incident);
    }
}
