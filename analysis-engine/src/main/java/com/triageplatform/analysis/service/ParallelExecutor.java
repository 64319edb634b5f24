package com.triageplatform.analysis.service;

import com.triageplatform.common.event.WorkerEventSink;
import com.triageplatform.common.exception.WorkerException;
import com.triageplatform.common.model.WorkerContext;
import com.triageplatform.common.model.WorkerEvent;
import com.triageplatform.common.model.WorkerPhase;
import com.triageplatform.common.model.WorkerResult;
import com.triageplatform.common.trace.TraceContextUtil;
import com.triageplatform.common.worker.AnalysisWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Runs every worker concurrently against one shared context and collects the results of the
 * workers that finished in time.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Each worker has its own error boundary: an exception, a {@code null} result or a
 *       timeout drops that worker's result and is logged; it never surfaces from
 *       {@link #execute} and never cancels or delays sibling workers.</li>
 *   <li>Each worker has its own timer (default {@value #DEFAULT_TIMEOUT_SECONDS}s).</li>
 *   <li>Results come back in worker order, whatever order the workers finished in.</li>
 *   <li>{@code executionTimeMs} on every returned result is the executor's own measurement.</li>
 *   <li>Lifecycle events are optional; a missing or failing sink changes nothing.</li>
 * </ul>
 *
 * <p>Log lines carry the invocation's traceId, read from the Reactor Context
 * ({@link TraceContextUtil#TRACE_ID_KEY}), so concurrent invocations stay distinguishable.
 *
 * <p>On timeout the subscription to the worker is cancelled, which interrupts its thread.
 * A worker that ignores interruption keeps running unobserved and its late result is dropped.
 */
public class ParallelExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final Duration timeout;
    private final Scheduler scheduler;

    public ParallelExecutor() {
        this(Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS));
    }

    public ParallelExecutor(Duration timeout) {
        this(timeout, Schedulers.boundedElastic());
    }

    public ParallelExecutor(Duration timeout, Scheduler scheduler) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Worker timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    public Duration timeout() {
        return timeout;
    }

    public Mono<List<WorkerResult>> execute(List<AnalysisWorker> workers, WorkerContext context) {
        return execute(workers, context, null);
    }

    /**
     * @param workers   workers to run, typically {@code WorkerRegistry.all()}
     * @param context   shared read-only snapshot passed to every worker
     * @param eventSink optional lifecycle observer; {@code null} means no events
     * @return results of the workers that completed successfully, possibly empty; never errors
     */
    public Mono<List<WorkerResult>> execute(List<AnalysisWorker> workers, WorkerContext context,
                                            WorkerEventSink eventSink) {
        if (workers == null || workers.isEmpty()) {
            return Mono.just(List.of());
        }
        WorkerEventSink sink = eventSink == null ? WorkerEventSink.none() : eventSink;

        return Mono.deferContextual(ctx -> {
            final long fanOutStart = System.nanoTime();
            String traceId = TraceContextUtil.getTraceId(ctx);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Dispatching {} workers in parallel. timeout={}s traceId={}",
                    workers.size(), timeout.toSeconds(), traceId));
            return Flux.fromIterable(workers)
                .flatMapSequential(worker -> runSafely(worker, context, sink, fanOutStart), workers.size())
                .collectList();
        });
    }

    private Mono<WorkerResult> runSafely(AnalysisWorker worker, WorkerContext context,
                                         WorkerEventSink sink, long fanOutStart) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            String name = workerNameOf(worker, traceId);
            if (name == null) {
                return Mono.<WorkerResult>empty();
            }
            final long workerStart = System.nanoTime();
            emit(sink, name, WorkerPhase.STARTED, "analyzing...", fanOutStart);

            return Mono.fromCallable(() -> worker.run(context))
                .subscribeOn(scheduler)
                .switchIfEmpty(Mono.error(() -> new WorkerException(name, "returned no result")))
                .timeout(timeout)
                .map(result -> {
                    double elapsedMs = elapsedMs(workerStart);
                    int count = result.hypotheses().size();
                    emit(sink, name, WorkerPhase.COMPLETED,
                        count + (count == 1 ? " hypothesis" : " hypotheses") + " generated", fanOutStart);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.info("Worker={} complete. hypotheses={} elapsedMs={} traceId={}",
                            name, count, String.format(Locale.ROOT, "%.0f", elapsedMs), traceId));
                    return result.withExecutionTimeMs(elapsedMs);
                })
                .onErrorResume(TimeoutException.class, e -> {
                    double elapsedMs = elapsedMs(workerStart);
                    emit(sink, name, WorkerPhase.ERRORED,
                        String.format(Locale.ROOT, "timed out after %.1fs", elapsedMs / 1000), fanOutStart);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("Worker={} timed out after {}s (limit: {}s), skipping. traceId={}",
                            name, String.format(Locale.ROOT, "%.1f", elapsedMs / 1000),
                            timeout.toSeconds(), traceId));
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    double elapsedMs = elapsedMs(workerStart);
                    emit(sink, name, WorkerPhase.ERRORED, String.valueOf(e.getMessage()), fanOutStart);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("Worker={} failed after {}ms, skipping. traceId={}",
                            name, String.format(Locale.ROOT, "%.0f", elapsedMs), traceId, e));
                    return Mono.empty();
                });
        });
    }

    /** Name of {@code worker}, or {@code null} (logged) if asking for it throws. */
    private static String workerNameOf(AnalysisWorker worker, String traceId) {
        try {
            return worker.workerName();
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(traceId, () ->
                log.error("Worker of type={} failed to report its name, skipping. traceId={}",
                    worker.getClass().getName(), traceId, e));
            return null;
        }
    }

    private void emit(WorkerEventSink sink, String workerName, WorkerPhase phase,
                      String message, long fanOutStart) {
        try {
            sink.emit(WorkerEvent.of(workerName, phase, message, elapsedMs(fanOutStart)));
        } catch (RuntimeException e) {
            log.warn("Event sink rejected {} event for worker={}, ignoring.", phase, workerName, e);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
