package com.quantflow.core.strategy;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Above/below memory per indicator pair, used to report a crossing edge exactly once.
 * Owned by the pipeline instance and passed to strategies on each evaluation.
 */
public final class CrossingState {

    private enum Relation { ABOVE, BELOW }

    private final Map<String, Relation> relations = new HashMap<>();
    private final Map<String, Boolean> flags = new HashMap<>();

    /**
     * Record the latest relation of {@code fast} to {@code slow} and report whether it flipped.
     * The first observation of a pair never reports a crossing; equal values keep the prior relation.
     */
    public Crossing update(String pair, BigDecimal fast, BigDecimal slow) {
        int cmp = fast.compareTo(slow);
        Relation previous = relations.get(pair);
        if (cmp == 0) {
            return Crossing.NONE;
        }
        Relation current = cmp > 0 ? Relation.ABOVE : Relation.BELOW;
        relations.put(pair, current);
        if (previous == null || previous == current) {
            return Crossing.NONE;
        }
        return current == Relation.ABOVE ? Crossing.UP : Crossing.DOWN;
    }

    /**
     * Record a boolean condition and report true only on the bar it becomes active.
     * Conditions start inactive.
     */
    public boolean activates(String condition, boolean active) {
        Boolean previous = flags.put(condition, active);
        return active && !Boolean.TRUE.equals(previous);
    }

    /** Forget a pair, e.g. after a gap in its inputs. */
    public void clear(String pair) {
        relations.remove(pair);
        flags.remove(pair);
    }

    public boolean isAbove(String pair) {
        return relations.get(pair) == Relation.ABOVE;
    }

    public boolean isKnown(String pair) {
        return relations.containsKey(pair);
    }
}
