package com.triageplatform.common.registry;

import com.triageplatform.common.exception.DuplicateWorkerException;
import com.triageplatform.common.worker.AnalysisWorker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Roster of workers keyed by name.
 *
 * <p>Iteration order is registration order. Ranking ties downstream are broken by the order in
 * which worker results are flattened, so this order is part of the pipeline's reproducibility
 * contract.
 *
 * <p>Registration is expected to finish before any invocation starts; the registry is read-only
 * while workers execute.
 */
public class WorkerRegistry {

    private final Map<String, AnalysisWorker> workers = new LinkedHashMap<>();

    /**
     * @throws DuplicateWorkerException if a worker with the same name is already registered
     */
    public synchronized void register(AnalysisWorker worker) {
        String name = worker.workerName();
        if (workers.containsKey(name)) {
            throw new DuplicateWorkerException(name);
        }
        workers.put(name, worker);
    }

    /** Copy of all workers in registration order. */
    public synchronized List<AnalysisWorker> all() {
        return new ArrayList<>(workers.values());
    }

    /** A missing worker is a valid answer, not an error. */
    public synchronized Optional<AnalysisWorker> lookup(String name) {
        return Optional.ofNullable(workers.get(name));
    }

    public synchronized int count() {
        return workers.size();
    }
}
