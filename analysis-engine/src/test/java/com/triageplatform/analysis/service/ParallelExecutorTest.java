package com.triageplatform.analysis.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;

import com.triageplatform.common.event.WorkerEventSink;
import com.triageplatform.common.exception.WorkerException;
import com.triageplatform.common.model.Hypothesis;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.WorkerContext;
import com.triageplatform.common.model.WorkerEvent;
import com.triageplatform.common.model.WorkerPhase;
import com.triageplatform.common.model.WorkerResult;
import com.triageplatform.common.trace.TraceContextUtil;
import com.triageplatform.common.worker.AnalysisWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ParallelExecutorTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(10);
    private static final WorkerContext CONTEXT = WorkerContext.of(List.of(), IncidentInput.empty("deploy-test"));

    /** Test worker whose behaviour is a function of the context. */
    private static AnalysisWorker worker(String name, Function<WorkerContext, WorkerResult> body) {
        return new AnalysisWorker() {
            @Override
            public WorkerResult run(WorkerContext context) {
                return body.apply(context);
            }

            @Override
            public String workerName() {
                return name;
            }
        };
    }

    private static AnalysisWorker succeeding(String name, long sleepMs) {
        return worker(name, ctx -> {
            sleep(sleepMs);
            return WorkerResult.of(name, List.of(
                Hypothesis.of(name + " finding", "from " + name, 0.6, Severity.MEDIUM, List.of("sig_001"), name)));
        });
    }

    private static AnalysisWorker throwing(String name) {
        return worker(name, ctx -> {
            throw new WorkerException(name, "LLM returned garbage");
        });
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    private static List<String> names(List<WorkerResult> results) {
        return results.stream().map(WorkerResult::workerName).toList();
    }

    // ── fault isolation ───────────────────────────────────────────────────

    @Nested
    @DisplayName("fault isolation")
    class FaultIsolation {

        @Test
        @DisplayName("N workers, one throws and one times out → N−2 results, siblings undelayed")
        void oneThrowsOneTimesOut() {
            ParallelExecutor executor = new ParallelExecutor(Duration.ofMillis(500));
            List<AnalysisWorker> workers = List.of(
                succeeding("log_agent", 50),
                throwing("broken_agent"),
                succeeding("metrics_agent", 150),
                worker("slow_agent", ctx -> {
                    sleep(5_000);
                    return WorkerResult.of("slow_agent", List.of());
                }),
                succeeding("commit_agent", 0));

            long start = System.nanoTime();
            StepVerifier.create(executor.execute(workers, CONTEXT))
                .assertNext(results -> {
                    assertEquals(List.of("log_agent", "metrics_agent", "commit_agent"), names(results));
                    for (WorkerResult r : results) {
                        assertEquals(1, r.hypotheses().size());
                        assertEquals(r.workerName() + " finding", r.hypotheses().get(0).label());
                    }
                })
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs < 3_000, "slow worker must not hold the batch, took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("every worker failing → empty list, no error signal")
        void allFail() {
            ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(2));
            StepVerifier.create(executor.execute(List.of(throwing("a"), throwing("b")), CONTEXT))
                .expectNext(List.of())
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("null result is treated as a failure")
        void nullResult() {
            ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(2));
            StepVerifier.create(executor.execute(
                    List.of(worker("null_agent", ctx -> null), succeeding("ok_agent", 0)), CONTEXT))
                .assertNext(results -> assertEquals(List.of("ok_agent"), names(results)))
                .expectComplete()
                .verify(VERIFY_TIMEOUT);
        }
    }

    // ── scheduling ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("workers run concurrently, not one after another")
    void concurrent() {
        ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(5));
        List<AnalysisWorker> workers = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            workers.add(succeeding("agent_" + i, 400));
        }

        long start = System.nanoTime();
        StepVerifier.create(executor.execute(workers, CONTEXT))
            .assertNext(results -> assertEquals(4, results.size()))
            .expectComplete()
            .verify(VERIFY_TIMEOUT);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 1_200, "expected parallel execution, took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("results come back in worker order, not completion order")
    void workerOrder() {
        ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(5));
        List<AnalysisWorker> workers = List.of(
            succeeding("first", 300), succeeding("second", 100), succeeding("third", 0));

        StepVerifier.create(executor.execute(workers, CONTEXT))
            .assertNext(results -> assertEquals(List.of("first", "second", "third"), names(results)))
            .expectComplete()
            .verify(VERIFY_TIMEOUT);
    }

    @Test
    @DisplayName("empty worker list → empty result, no events")
    void emptyWorkers() {
        List<WorkerEvent> events = new ArrayList<>();
        StepVerifier.create(new ParallelExecutor().execute(List.of(), CONTEXT, events::add))
            .expectNext(List.of())
            .verifyComplete();
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("every worker receives the same context instance")
    void sharedContext() {
        ConcurrentLinkedQueue<WorkerContext> seen = new ConcurrentLinkedQueue<>();
        Function<WorkerContext, WorkerResult> record = ctx -> {
            seen.add(ctx);
            return WorkerResult.of("w", List.of());
        };
        ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(2));
        executor.execute(List.of(worker("a", record), worker("b", record)), CONTEXT).block(VERIFY_TIMEOUT);

        assertEquals(2, seen.size());
        seen.forEach(ctx -> assertSame(CONTEXT, ctx));
    }

    @Test
    @DisplayName("executor overwrites self-reported execution time")
    void executorOwnsTiming() {
        AnalysisWorker liar = worker("liar", ctx -> {
            sleep(60);
            return new WorkerResult("liar", List.of(), 99_999.0);
        });

        List<WorkerResult> results = new ParallelExecutor(Duration.ofSeconds(2))
            .execute(List.of(liar), CONTEXT).block(VERIFY_TIMEOUT);

        double measured = results.get(0).executionTimeMs();
        assertTrue(measured >= 50 && measured < 5_000, "measured " + measured);
    }

    @Test
    @DisplayName("non-positive timeout is rejected at construction")
    void invalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelExecutor(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ParallelExecutor(Duration.ofSeconds(-1)));
    }

    // ── lifecycle events ───────────────────────────────────────────────────

    @Nested
    @DisplayName("lifecycle events")
    class Events {

        @Test
        @DisplayName("started precedes completed/errored for each worker")
        void orderedPerWorker() {
            ConcurrentLinkedQueue<WorkerEvent> events = new ConcurrentLinkedQueue<>();
            ParallelExecutor executor = new ParallelExecutor(Duration.ofMillis(300));
            executor.execute(List.of(
                    succeeding("ok", 0),
                    throwing("boom"),
                    worker("slow", ctx -> {
                        sleep(3_000);
                        return WorkerResult.of("slow", List.of());
                    })),
                CONTEXT, events::add).block(VERIFY_TIMEOUT);

            assertPhases(events, "ok", WorkerPhase.STARTED, WorkerPhase.COMPLETED);
            assertPhases(events, "boom", WorkerPhase.STARTED, WorkerPhase.ERRORED);
            assertPhases(events, "slow", WorkerPhase.STARTED, WorkerPhase.ERRORED);

            WorkerEvent completed = forWorker(events, "ok").get(1);
            assertEquals("1 hypothesis generated", completed.message());
            assertTrue(forWorker(events, "boom").get(1).message().contains("LLM returned garbage"));
            assertTrue(forWorker(events, "slow").get(1).message().startsWith("timed out after"));

            for (WorkerEvent e : events) {
                assertTrue(e.timestampMs() >= 0.0);
            }
        }

        @Test
        @DisplayName("a throwing sink does not change the outcome")
        void failingSink() {
            AtomicInteger calls = new AtomicInteger();
            WorkerEventSink hostile = event -> {
                calls.incrementAndGet();
                throw new IllegalStateException("display crashed");
            };
            ParallelExecutor executor = new ParallelExecutor(Duration.ofSeconds(2));

            List<WorkerResult> withSink = executor.execute(
                List.of(succeeding("a", 0), succeeding("b", 0)), CONTEXT, hostile).block(VERIFY_TIMEOUT);

            assertEquals(List.of("a", "b"), names(withSink));
            assertEquals(4, calls.get());
        }

        private List<WorkerEvent> forWorker(ConcurrentLinkedQueue<WorkerEvent> events, String name) {
            return events.stream().filter(e -> e.workerName().equals(name)).toList();
        }

        private void assertPhases(ConcurrentLinkedQueue<WorkerEvent> events, String name, WorkerPhase... expected) {
            assertEquals(List.of(expected), forWorker(events, name).stream().map(WorkerEvent::phase).toList());
        }
    }

    // ── shared context ─────────────────────────────────────────────────────

    @Test
    @DisplayName("a worker cannot rewrite incident data its siblings read")
    void contextIsReadOnly() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("db_connection_pool_used", 20);
        WorkerContext shared = WorkerContext.of(List.of(),
            IncidentInput.of("deploy-ro", List.of(), metrics, List.of(), Map.of()));
        AtomicReference<Object> seen = new AtomicReference<>();

        AnalysisWorker vandal = worker("vandal", ctx -> {
            ctx.incident().metrics().put("db_connection_pool_used", -1);
            return WorkerResult.of("vandal", List.of());
        });
        AnalysisWorker reader = worker("reader", ctx -> {
            sleep(100);
            seen.set(ctx.incident().metrics().get("db_connection_pool_used"));
            return WorkerResult.of("reader", List.of());
        });

        List<WorkerResult> results = new ParallelExecutor(Duration.ofSeconds(2))
            .execute(List.of(vandal, reader), shared).block(VERIFY_TIMEOUT);

        assertEquals(List.of("reader"), names(results), "the write attempt fails the vandal only");
        assertEquals(20, seen.get());
    }

    @Test
    @DisplayName("worker whose name getter throws is skipped, siblings still run")
    void throwingNameGetter() {
        AnalysisWorker nameless = new AnalysisWorker() {
            @Override
            public WorkerResult run(WorkerContext context) {
                return WorkerResult.of("nameless", List.of());
            }

            @Override
            public String workerName() {
                throw new IllegalStateException("no name configured");
            }
        };

        StepVerifier.create(new ParallelExecutor(Duration.ofSeconds(2))
                .execute(List.of(succeeding("a", 0), nameless, succeeding("b", 0)), CONTEXT))
            .assertNext(results -> assertEquals(List.of("a", "b"), names(results)))
            .expectComplete()
            .verify(VERIFY_TIMEOUT);
    }

    // ── trace propagation ──────────────────────────────────────────────────

    @Test
    @DisplayName("failure and timeout logs carry the invocation traceId in MDC")
    void traceIdInFailureLogs() {
        Logger executorLog = (Logger) LoggerFactory.getLogger(ParallelExecutor.class);
        ConcurrentLinkedQueue<String> errorTraceIds = new ConcurrentLinkedQueue<>();
        AppenderBase<ILoggingEvent> capture = new AppenderBase<>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    errorTraceIds.add(String.valueOf(event.getMDCPropertyMap().get(TraceContextUtil.TRACE_ID_KEY)));
                }
            }
        };
        capture.start();
        executorLog.addAppender(capture);
        try {
            ParallelExecutor executor = new ParallelExecutor(Duration.ofMillis(300));
            List<AnalysisWorker> workers = List.of(
                throwing("boom"),
                worker("slow", ctx -> {
                    sleep(3_000);
                    return WorkerResult.of("slow", List.of());
                }));

            TraceContextUtil.withTraceId(executor.execute(workers, CONTEXT), "exec-42").block(VERIFY_TIMEOUT);

            assertEquals(List.of("exec-42", "exec-42"), List.copyOf(errorTraceIds));
        } finally {
            executorLog.detachAppender(capture);
            capture.stop();
        }
    }
}
