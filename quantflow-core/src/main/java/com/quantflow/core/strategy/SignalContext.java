package com.quantflow.core.strategy;

import com.quantflow.core.indicator.IndicatorSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The state a strategy may consult besides the current snapshot: crossing memory and a short
 * history of earlier snapshots (oldest first). The driver records each snapshot after evaluating it.
 */
public final class SignalContext {
    private static final int DEFAULT_HISTORY = 5;

    private final CrossingState crossings;
    private final Deque<IndicatorSnapshot> recent;
    private final int capacity;

    public SignalContext() {
        this(new CrossingState(), DEFAULT_HISTORY);
    }

    public SignalContext(CrossingState crossings, int capacity) {
        this.crossings = crossings;
        this.capacity = capacity;
        this.recent = new ArrayDeque<>(capacity);
    }

    public CrossingState crossings() {
        return crossings;
    }

    public List<IndicatorSnapshot> recent() {
        return new ArrayList<>(recent);
    }

    public Optional<IndicatorSnapshot> previous() {
        return Optional.ofNullable(recent.peekLast());
    }

    public void record(IndicatorSnapshot snapshot) {
        if (recent.size() == capacity) {
            recent.removeFirst();
        }
        recent.addLast(snapshot);
    }
}
