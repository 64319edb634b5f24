package com.triageplatform.common.event;

import com.triageplatform.common.model.WorkerEvent;

/**
 * Optional observer of worker lifecycle events.
 *
 * <p>Implementations must return quickly and must not block on a consumer: the executor calls
 * {@link #emit} from worker threads. Pipeline outcome never depends on what a sink does.
 */
@FunctionalInterface
public interface WorkerEventSink {

    WorkerEventSink NONE = event -> { };

    void emit(WorkerEvent event);

    static WorkerEventSink none() {
        return NONE;
    }
}
