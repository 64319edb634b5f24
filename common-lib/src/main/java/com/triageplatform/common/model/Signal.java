package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A verified fact extracted from an incident before any worker runs.
 *
 * <p>{@code id} is assigned sequentially by the extractor ({@code sig_001}, {@code sig_002}, ...).
 * {@code value} is {@code null} for qualitative signals such as code or config changes.
 */
public record Signal(
    @JsonProperty("id")          String id,
    @JsonProperty("type")        String type,        // log_anomaly / metric_spike / config_change ...
    @JsonProperty("description") String description,
    @JsonProperty("value")       Double value,
    @JsonProperty("severity")    Severity severity,
    @JsonProperty("source")      String source
) {
    /** Placeholder id carried by analyzer output until the extractor numbers the batch. */
    public static final String UNASSIGNED_ID = "placeholder";

    public static Signal of(String id, String type, String description,
                            Double value, Severity severity, String source) {
        return new Signal(id, type, description, value, severity, source);
    }

    public static Signal unassigned(String type, String description,
                                    Double value, Severity severity, String source) {
        return new Signal(UNASSIGNED_ID, type, description, value, severity, source);
    }

    public Signal withId(String newId) {
        return new Signal(newId, type, description, value, severity, source);
    }
}
