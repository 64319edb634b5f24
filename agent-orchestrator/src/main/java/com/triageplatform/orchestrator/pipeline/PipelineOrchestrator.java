package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.analysis.service.ParallelExecutor;
import com.triageplatform.common.aggregation.HypothesisAggregator;
import com.triageplatform.common.event.WorkerEventSink;
import com.triageplatform.common.evidence.EvidenceStore;
import com.triageplatform.common.extraction.SignalExtractor;
import com.triageplatform.common.model.ExecutionResult;
import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Signal;
import com.triageplatform.common.model.SynthesisResult;
import com.triageplatform.common.model.Verdict;
import com.triageplatform.common.model.WorkerContext;
import com.triageplatform.common.model.WorkerResult;
import com.triageplatform.common.registry.WorkerRegistry;
import com.triageplatform.common.synthesis.NarrativeSynthesizer;
import com.triageplatform.common.trace.TraceContextUtil;
import com.triageplatform.common.validation.ResultValidator;
import com.triageplatform.common.worker.AnalysisWorker;
import com.triageplatform.orchestrator.logger.PipelineFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one incident through the pipeline:
 * <pre>
 *   INIT → EXTRACT → DISPATCH → VALIDATE → AGGREGATE → SYNTHESIZE → DECIDE → DONE
 * </pre>
 *
 * <p>Every invocation gets its own {@link EvidenceStore} and execution id; nothing mutable is
 * shared between invocations apart from the registry, which is read-only once requests flow.
 * Only a duplicate registration throws. Extractor, worker and synthesizer failures are logged
 * and degrade the result instead of failing it.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    /** Top confidence below this requires a human to look before acting. */
    public static final double REVIEW_THRESHOLD = 0.5;

    private final WorkerRegistry registry;
    private final SignalExtractor extractor;
    private final ParallelExecutor executor;
    private final ResultValidator validator;
    private final HypothesisAggregator aggregator;
    private final NarrativeSynthesizer synthesizer;
    private final PipelineFlowLogger flowLogger;

    /**
     * @param synthesizer optional; {@code null} means the deterministic fallback narrative is used
     */
    public PipelineOrchestrator(WorkerRegistry registry,
                                SignalExtractor extractor,
                                ParallelExecutor executor,
                                ResultValidator validator,
                                HypothesisAggregator aggregator,
                                NarrativeSynthesizer synthesizer,
                                PipelineFlowLogger flowLogger) {
        this.registry    = registry;
        this.extractor   = extractor;
        this.executor    = executor;
        this.validator   = validator;
        this.aggregator  = aggregator;
        this.synthesizer = synthesizer;
        this.flowLogger  = flowLogger;
    }

    /**
     * @throws com.triageplatform.common.exception.DuplicateWorkerException if the name is taken
     */
    public void register(AnalysisWorker worker) {
        registry.register(worker);
        log.info("Worker registered. worker={} total={}", worker.workerName(), registry.count());
    }

    public Mono<ExecutionResult> execute(IncidentInput incident) {
        return execute(incident, WorkerEventSink.none());
    }

    /**
     * @param eventSink lifecycle observer for the workers of this invocation; {@code null} means none
     * @return the final result; never errors for worker, extractor or synthesizer failures
     */
    public Mono<ExecutionResult> execute(IncidentInput incident, WorkerEventSink eventSink) {
        String executionId = UUID.randomUUID().toString();

        Mono<ExecutionResult> pipeline = Mono.defer(() -> {
            flowLogger.logWithTraceId(PipelineFlowLogger.INIT, executionId,
                "deploymentId", incident.deploymentId());
            EvidenceStore store = new EvidenceStore();

            store.addSignals(extractSignals(incident, executionId));
            flowLogger.logWithTraceId(PipelineFlowLogger.EXTRACT, executionId, "signals", store.size());

            WorkerContext context = WorkerContext.of(store.signals(), incident);
            List<AnalysisWorker> workers = registry.all();

            return executor.execute(workers, context, eventSink)
                .map(results -> {
                    flowLogger.logWithTraceId(PipelineFlowLogger.DISPATCH, executionId,
                        "completed", results.size() + "/" + workers.size());
                    return decide(results, store, executionId);
                });
        })
        .subscribeOn(Schedulers.boundedElastic())
        .doOnEach(flowLogger.stage(PipelineFlowLogger.DONE));

        return TraceContextUtil.withTraceId(pipeline, executionId);
    }

    private List<Signal> extractSignals(IncidentInput incident, String executionId) {
        try {
            List<Signal> signals = extractor.extract(incident);
            return signals == null ? List.of() : signals;
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.error("Signal extraction failed, continuing with no signals. deploymentId={}",
                    incident.deploymentId(), e));
            return List.of();
        }
    }

    private ExecutionResult decide(List<WorkerResult> results, EvidenceStore store, String executionId) {
        List<Verdict> verdicts = new ArrayList<>(results.size());
        for (WorkerResult result : results) {
            Verdict verdict = validator.validate(result, store);
            if (!verdict.valid()) {
                TraceContextUtil.withMdc(executionId, () ->
                    log.warn("Worker result rejected. worker={} reason={}",
                        result.workerName(), verdict.rejectionReason()));
            }
            verdicts.add(verdict);
        }
        long accepted = verdicts.stream().filter(Verdict::valid).count();
        flowLogger.logWithTraceId(PipelineFlowLogger.VALIDATE, executionId,
            "accepted", accepted + "/" + verdicts.size());

        List<Hypothesis> ranked = aggregator.aggregate(verdicts);
        flowLogger.logWithTraceId(PipelineFlowLogger.AGGREGATE, executionId, "ranked", ranked.size());

        List<Signal> signals = store.signals();
        SynthesisResult synthesis = synthesize(signals, ranked, executionId);
        flowLogger.logWithTraceId(PipelineFlowLogger.SYNTHESIZE, executionId);

        boolean review = requiresHumanReview(ranked);
        flowLogger.logWithTraceId(PipelineFlowLogger.DECIDE, executionId, "requiresHumanReview", review);

        return new ExecutionResult(ranked, signals, executionId, synthesis, review);
    }

    private SynthesisResult synthesize(List<Signal> signals, List<Hypothesis> ranked, String executionId) {
        if (synthesizer == null) {
            return FallbackNarratives.forRanking(ranked);
        }
        try {
            SynthesisResult result = synthesizer.synthesize(signals, ranked);
            if (result != null) {
                return result;
            }
            TraceContextUtil.withMdc(executionId, () ->
                log.warn("Narrative synthesizer returned no result, using fallback"));
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(executionId, () ->
                log.error("Narrative synthesizer failed, using fallback", e));
        }
        return FallbackNarratives.forRanking(ranked);
    }

    static boolean requiresHumanReview(List<Hypothesis> ranked) {
        return ranked.isEmpty() || ranked.get(0).confidence() < REVIEW_THRESHOLD;
    }
}
