package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Narrative explanation of a ranking, produced after aggregation.
 * {@code confidenceInRanking} is clamped to [0, 1]; NaN becomes 0.
 */
public record SynthesisResult(
    @JsonProperty("summary")             String summary,
    @JsonProperty("keyFinding")          String keyFinding,
    @JsonProperty("confidenceInRanking") double confidenceInRanking
) {
    public SynthesisResult {
        confidenceInRanking = Double.isNaN(confidenceInRanking)
            ? 0.0
            : Math.max(0.0, Math.min(1.0, confidenceInRanking));
    }
}
