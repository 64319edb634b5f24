package com.triageplatform.common.worker;

import com.triageplatform.common.model.WorkerContext;
import com.triageplatform.common.model.WorkerResult;

/**
 * An independent unit that reads the shared {@link WorkerContext} and proposes hypotheses.
 *
 * <p>{@link #run} is a blocking call and may take long (LLM or other I/O). It may throw, or
 * outlive the executor timeout; either way the pipeline treats the worker as having produced
 * nothing. Implementations must not modify the context.
 */
public interface AnalysisWorker {
    WorkerResult run(WorkerContext context);
    String workerName();
}
