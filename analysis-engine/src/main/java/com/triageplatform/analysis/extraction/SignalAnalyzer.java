package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Signal;

import java.util.List;

/**
 * One deterministic sub-analysis of an incident. Output signals carry
 * {@link Signal#UNASSIGNED_ID}; the extractor numbers the combined batch.
 */
public interface SignalAnalyzer {
    List<Signal> analyze(IncidentInput incident);
    String analyzerName();
}
