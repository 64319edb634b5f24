package com.triageplatform.common.validation;

import com.triageplatform.common.evidence.EvidenceStore;
import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.Verdict;
import com.triageplatform.common.model.WorkerResult;

import java.util.Set;
import java.util.TreeSet;

/**
 * Deterministic gate between worker output and aggregation.
 *
 * <h3>Checks (fixed order, first failure wins)</h3>
 * <ol>
 *   <li>Worker name is non-empty after trimming.</li>
 *   <li>Every hypothesis cites at least one signal.</li>
 *   <li>Every cited signal id exists in the evidence store.</li>
 *   <li>Every confidence lies in [0.0, 1.0].</li>
 * </ol>
 *
 * <p>A result with zero hypotheses is valid: finding nothing is not a violation.
 *
 * <p>This class is stateless and thread-safe. Verdicts are a pure function of the result and
 * the store's ids, so any rejection can be reproduced without re-running the worker.
 */
public class ResultValidator {

    public Verdict validate(WorkerResult result, EvidenceStore store) {
        String workerName = result.workerName();

        if (workerName == null || workerName.isBlank()) {
            return Verdict.rejected(result, "workerName is empty or whitespace.");
        }

        for (Hypothesis h : result.hypotheses()) {
            if (h.supportingSignals().isEmpty()) {
                return Verdict.rejected(result, String.format(
                    "Hypothesis '%s' from worker '%s' has no supporting signals.",
                    h.label(), workerName));
            }
        }

        Set<String> knownIds = store.signalIds();
        for (Hypothesis h : result.hypotheses()) {
            for (String signalId : h.supportingSignals()) {
                if (!knownIds.contains(signalId)) {
                    return Verdict.rejected(result, String.format(
                        "Hypothesis '%s' from worker '%s' cites unknown signal ID '%s'. Valid IDs: %s",
                        h.label(), workerName, signalId, new TreeSet<>(knownIds)));
                }
            }
        }

        // Normally unreachable for well-behaved workers; NaN fails both comparisons.
        for (Hypothesis h : result.hypotheses()) {
            if (!(h.confidence() >= 0.0 && h.confidence() <= 1.0)) {
                return Verdict.rejected(result, String.format(
                    "Hypothesis '%s' from worker '%s' has invalid confidence %s (must be 0.0-1.0).",
                    h.label(), workerName, h.confidence()));
            }
        }

        return Verdict.accepted(result);
    }
}
