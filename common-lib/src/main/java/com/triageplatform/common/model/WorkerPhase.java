package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle stages the executor reports for each worker.
 */
public enum WorkerPhase {
    STARTED,
    COMPLETED,
    ERRORED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
