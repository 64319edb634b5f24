package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A candidate root cause proposed by a worker.
 *
 * <p>A hypothesis created by a worker has exactly one entry in {@code contributingWorkers}.
 * After aggregation the list holds the sorted, de-duplicated names of every worker whose
 * hypothesis was merged into it. Instances are never edited; merging produces a new record.
 */
public record Hypothesis(
    @JsonProperty("label")               String label,
    @JsonProperty("description")         String description,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("severity")            Severity severity,
    @JsonProperty("supportingSignals")   List<String> supportingSignals,
    @JsonProperty("contributingWorkers") List<String> contributingWorkers
) {
    public Hypothesis {
        supportingSignals   = supportingSignals == null ? List.of() : List.copyOf(supportingSignals);
        contributingWorkers = contributingWorkers == null ? List.of() : List.copyOf(contributingWorkers);
    }

    public static Hypothesis of(String label, String description, double confidence,
                                Severity severity, List<String> supportingSignals,
                                String workerName) {
        return new Hypothesis(label, description, confidence, severity, supportingSignals,
                              List.of(workerName));
    }

    /** Contributors joined with {@code ", "}, e.g. {@code "commit_agent, metrics_agent"}. */
    @JsonIgnore
    public String contributorsLabel() {
        return String.join(", ", contributingWorkers);
    }
}
