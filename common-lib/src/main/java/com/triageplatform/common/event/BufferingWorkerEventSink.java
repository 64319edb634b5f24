package com.triageplatform.common.event;

import com.triageplatform.common.model.WorkerEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * {@link WorkerEventSink} backed by a Reactor replay sink, for live displays.
 *
 * <p>Emission never waits for a subscriber: events are buffered until drained, and a late
 * subscriber still receives every event of the invocation in emission order. One instance
 * serves one invocation; call {@link #complete()} once the pipeline has returned.
 */
public class BufferingWorkerEventSink implements WorkerEventSink {

    /** Upper bound on spinning while another thread holds the emission slot. */
    static final Duration CONTENTION_BUDGET = Duration.ofMillis(200);

    private final Sinks.Many<WorkerEvent> sink = Sinks.many().replay().all();
    private final Sinks.EmitFailureHandler retryOnContention =
        Sinks.EmitFailureHandler.busyLooping(CONTENTION_BUDGET);

    /**
     * @throws Sinks.EmissionException if the slot stays contended past {@link #CONTENTION_BUDGET}
     */
    @Override
    public void emit(WorkerEvent event) {
        sink.emitNext(event, retryOnContention);
    }

    public void complete() {
        sink.emitComplete(retryOnContention);
    }

    public Flux<WorkerEvent> events() {
        return sink.asFlux();
    }
}
