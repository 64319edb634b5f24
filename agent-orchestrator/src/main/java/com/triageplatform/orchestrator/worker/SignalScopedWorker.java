package com.triageplatform.orchestrator.worker;

import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;
import com.triageplatform.common.model.WorkerContext;
import com.triageplatform.common.model.WorkerResult;
import com.triageplatform.common.worker.AnalysisWorker;

import java.util.List;

/**
 * Rule-based worker that proposes one fixed hypothesis backed by the signals of a single
 * analyzer source (matched by substring on {@link Signal#source()}). Falls back to the first
 * signal when its source produced nothing, and proposes nothing when there are no signals.
 *
 * <p>Stands in for a reasoning worker so the service produces a ranking out of the box.
 */
public class SignalScopedWorker implements AnalysisWorker {

    static final int MAX_CITED = 2;

    private final String name;
    private final String label;
    private final String description;
    private final double confidence;
    private final String sourceKeyword;

    public SignalScopedWorker(String name, String label, String description,
                              double confidence, String sourceKeyword) {
        this.name = name;
        this.label = label;
        this.description = description;
        this.confidence = confidence;
        this.sourceKeyword = sourceKeyword;
    }

    @Override
    public String workerName() {
        return name;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        List<Signal> scoped = context.signals().stream()
            .filter(s -> s.source() != null && s.source().contains(sourceKeyword))
            .toList();
        if (scoped.isEmpty()) {
            scoped = context.signals().stream().limit(1).toList();
        }
        if (scoped.isEmpty()) {
            return WorkerResult.of(name, List.of());
        }
        List<String> cited = scoped.stream().limit(MAX_CITED).map(Signal::id).toList();
        return WorkerResult.of(name, List.of(
            Hypothesis.of(label, description, confidence, Severity.HIGH, cited, name)));
    }
}
