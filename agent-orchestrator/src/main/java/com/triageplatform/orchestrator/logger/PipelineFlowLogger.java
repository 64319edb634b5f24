package com.triageplatform.orchestrator.logger;

import com.triageplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of one pipeline invocation. Pure side-effects, no pipeline logic.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #INIT}       : invocation accepted, evidence store allocated</li>
 *   <li>{@link #EXTRACT}    : signals written to the evidence store</li>
 *   <li>{@link #DISPATCH}   : all workers reached a terminal state</li>
 *   <li>{@link #VALIDATE}   : every result has a verdict</li>
 *   <li>{@link #AGGREGATE}  : accepted hypotheses merged and ranked</li>
 *   <li>{@link #SYNTHESIZE} : narrative produced (collaborator or fallback)</li>
 *   <li>{@link #DECIDE}     : review flag computed</li>
 *   <li>{@link #DONE}       : result emitted to the caller</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.DONE))
 * </pre>
 */
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String INIT       = "INIT";
    public static final String EXTRACT    = "EXTRACT";
    public static final String DISPATCH   = "DISPATCH";
    public static final String VALIDATE   = "VALIDATE";
    public static final String AGGREGATE  = "AGGREGATE";
    public static final String SYNTHESIZE = "SYNTHESIZE";
    public static final String DECIDE     = "DECIDE";
    public static final String DONE       = "DONE";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The traceId comes from the Reactor Context and is bridged to MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            logWithTraceId(stageName, traceId);
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** Stage log with one extra {@code key=value} detail, e.g. counts. */
    public void logWithTraceId(String stageName, String traceId, String detailKey, Object detailValue) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} {}={} traceId={}", stageName, detailKey, detailValue, traceId)
        );
    }
}
