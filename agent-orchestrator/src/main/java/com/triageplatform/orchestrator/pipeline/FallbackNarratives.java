package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.SynthesisResult;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic narrative used when no {@code NarrativeSynthesizer} is configured, or when the
 * configured one fails. Never returns {@code null}.
 */
public final class FallbackNarratives {

    static final String NO_HYPOTHESES_SUMMARY =
        "No validated hypotheses were produced from the current signal set. "
            + "A human should review logs, metrics, and recent changes directly.";
    static final String NO_HYPOTHESES_FINDING =
        "Insufficient evidence to identify a likely root cause.";

    private FallbackNarratives() {}

    public static SynthesisResult forRanking(List<Hypothesis> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            return new SynthesisResult(NO_HYPOTHESES_SUMMARY, NO_HYPOTHESES_FINDING, 0.0);
        }
        Hypothesis top = ranked.get(0);
        String summary = String.format(Locale.ROOT,
            "Top hypothesis: %s (confidence %.2f), reported by %s.",
            top.label(), top.confidence(), top.contributorsLabel());
        return new SynthesisResult(summary, top.label() + ": " + top.description(), top.confidence());
    }
}
