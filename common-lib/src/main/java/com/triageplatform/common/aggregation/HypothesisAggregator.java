package com.triageplatform.common.aggregation;

import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.Verdict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges corroborating hypotheses from accepted worker results into one ranked list.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Flatten hypotheses of valid verdicts, preserving verdict order.</li>
 *   <li>Group greedily: each hypothesis joins the first group whose representative (first
 *       member) matches it per {@link LabelMatcher}; otherwise it opens a new group.</li>
 *   <li>Merge each group into a new hypothesis (see below).</li>
 *   <li>Stable sort by confidence, descending. Ties keep flattening order.</li>
 *   <li>Keep the first {@value #MAX_RANKED}.</li>
 * </ol>
 *
 * <h3>Merge scoring</h3>
 * <pre>
 *   agreementBonus  = 0.1 × (groupSize − 1)
 *   finalConfidence = round4(min(maxConfidence + agreementBonus, 1.0))
 * </pre>
 * Contributors become the sorted, de-duplicated union; supporting signals the union in
 * first-seen order. Label, description and severity come from the highest-confidence member.
 *
 * <p>Group membership only guarantees that each member matches the representative; two
 * non-representative members need not match each other.
 *
 * <p>This class is stateless and thread-safe. It does NOT modify the input hypotheses.
 */
public class HypothesisAggregator {

    public static final int    MAX_RANKED      = 5;
    static final double        AGREEMENT_BONUS = 0.1;

    public List<Hypothesis> aggregate(List<Verdict> verdicts) {
        List<Hypothesis> flattened = collectValid(verdicts);
        if (flattened.isEmpty()) {
            return List.of();
        }

        List<Hypothesis> merged = new ArrayList<>();
        for (List<Hypothesis> group : groupByLabel(flattened)) {
            merged.add(mergeGroup(group));
        }

        // List.sort is a stable merge sort.
        merged.sort(Comparator.comparingDouble(Hypothesis::confidence).reversed());

        return List.copyOf(merged.subList(0, Math.min(MAX_RANKED, merged.size())));
    }

    private List<Hypothesis> collectValid(List<Verdict> verdicts) {
        List<Hypothesis> hypotheses = new ArrayList<>();
        for (Verdict verdict : verdicts) {
            if (verdict.valid()) {
                hypotheses.addAll(verdict.result().hypotheses());
            }
        }
        return hypotheses;
    }

    List<List<Hypothesis>> groupByLabel(List<Hypothesis> hypotheses) {
        List<List<Hypothesis>> groups = new ArrayList<>();
        for (Hypothesis hypothesis : hypotheses) {
            List<Hypothesis> target = null;
            for (List<Hypothesis> group : groups) {
                if (LabelMatcher.matches(hypothesis.label(), group.get(0).label())) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                groups.add(target);
            }
            target.add(hypothesis);
        }
        return groups;
    }

    Hypothesis mergeGroup(List<Hypothesis> group) {
        Hypothesis best = group.get(0);
        for (Hypothesis h : group) {
            if (h.confidence() > best.confidence()) {
                best = h;
            }
        }

        double bonus = AGREEMENT_BONUS * (group.size() - 1);
        double finalConfidence = round4(Math.min(best.confidence() + bonus, 1.0));

        Set<String> contributors = new TreeSet<>();
        Set<String> signals = new LinkedHashSet<>();
        for (Hypothesis h : group) {
            contributors.addAll(h.contributingWorkers());
            signals.addAll(h.supportingSignals());
        }

        return new Hypothesis(best.label(), best.description(), finalConfidence, best.severity(),
                              new ArrayList<>(signals), new ArrayList<>(contributors));
    }

    static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
