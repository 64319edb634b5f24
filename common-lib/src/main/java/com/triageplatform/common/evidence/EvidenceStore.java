package com.triageplatform.common.evidence;

import com.triageplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only store of the signals extracted for one pipeline invocation.
 *
 * <p>Signals can be added but never removed or replaced. All writes happen before workers are
 * dispatched, so concurrent readers during dispatch always see a stable list and the validator
 * can trust that an id present now was present while workers ran.
 *
 * <p>A store lives for exactly one invocation and is discarded afterwards.
 */
public class EvidenceStore {

    private final List<Signal> signals = new ArrayList<>();

    public synchronized void addSignal(Signal signal) {
        signals.add(signal);
    }

    /** Appends every signal in order. An empty list is a no-op. */
    public synchronized void addSignals(List<Signal> batch) {
        signals.addAll(batch);
    }

    /** Unmodifiable copy of all signals, in insertion order. */
    public synchronized List<Signal> signals() {
        return List.copyOf(signals);
    }

    /** Ids of every stored signal, for constant-time citation checks. */
    public synchronized Set<String> signalIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Signal s : signals) {
            ids.add(s.id());
        }
        return Collections.unmodifiableSet(ids);
    }

    public synchronized int size() {
        return signals.size();
    }
}
