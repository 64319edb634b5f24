package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output of one pipeline invocation. The only object that crosses the pipeline
 * boundary to the caller.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code rankedHypotheses}   : at most five, highest confidence first</li>
 *   <li>{@code signalsUsed}        : every signal that was in the evidence store, for audit</li>
 *   <li>{@code executionId}        : random UUID, unique per invocation</li>
 *   <li>{@code synthesis}          : narrative summary of the ranking</li>
 *   <li>{@code requiresHumanReview}: ranking is empty or not confident enough to act on</li>
 * </ul>
 */
public record ExecutionResult(
    @JsonProperty("rankedHypotheses")    List<Hypothesis> rankedHypotheses,
    @JsonProperty("signalsUsed")         List<Signal> signalsUsed,
    @JsonProperty("executionId")         String executionId,
    @JsonProperty("synthesis")           SynthesisResult synthesis,
    @JsonProperty("requiresHumanReview") boolean requiresHumanReview
) {
    public ExecutionResult {
        rankedHypotheses = rankedHypotheses == null ? List.of() : List.copyOf(rankedHypotheses);
        signalsUsed      = signalsUsed == null ? List.of() : List.copyOf(signalsUsed);
    }
}
