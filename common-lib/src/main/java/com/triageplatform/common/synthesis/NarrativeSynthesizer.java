package com.triageplatform.common.synthesis;

import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.Signal;
import com.triageplatform.common.model.SynthesisResult;

import java.util.List;

/**
 * Explains an existing ranking in plain language. Runs after aggregation and never changes
 * the ranking itself. Optional: without one the orchestrator builds a canned narrative.
 */
public interface NarrativeSynthesizer {
    SynthesisResult synthesize(List<Signal> signals, List<Hypothesis> rankedHypotheses);
}
