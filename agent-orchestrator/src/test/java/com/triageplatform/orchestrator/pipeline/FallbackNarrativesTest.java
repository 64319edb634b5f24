package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.SynthesisResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackNarrativesTest {

    @Test
    @DisplayName("empty ranking → insufficient evidence at zero confidence")
    void emptyRanking() {
        SynthesisResult result = FallbackNarratives.forRanking(List.of());

        assertEquals("No validated hypotheses were produced from the current signal set. "
            + "A human should review logs, metrics, and recent changes directly.", result.summary());
        assertEquals("Insufficient evidence to identify a likely root cause.", result.keyFinding());
        assertEquals(0.0, result.confidenceInRanking());
        assertEquals(result, FallbackNarratives.forRanking(null));
    }

    @Test
    @DisplayName("non-empty ranking → narrative about the top hypothesis")
    void topHypothesis() {
        Hypothesis top = new Hypothesis("Cache Removal Impact", "Recent commit removed cache layer",
            0.78, Severity.HIGH, List.of("sig_004"), List.of("commit_agent", "log_agent"));
        Hypothesis second = Hypothesis.of("Error Rate Spike", "Errors up", 0.6, Severity.MEDIUM,
            List.of("sig_001"), "log_agent");

        SynthesisResult result = FallbackNarratives.forRanking(List.of(top, second));

        assertEquals("Top hypothesis: Cache Removal Impact (confidence 0.78), reported by commit_agent, log_agent.",
            result.summary());
        assertEquals("Cache Removal Impact: Recent commit removed cache layer", result.keyFinding());
        assertEquals(0.78, result.confidenceInRanking());
    }
}
