package com.quantflow.core.engine;

import com.quantflow.core.model.Bar;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Non-blocking iteration over a fixed list of stored bars.
 */
public final class HistoricalBarSource implements BarSource {

    private final Iterator<Bar> bars;

    public HistoricalBarSource(List<Bar> bars) {
        this.bars = List.copyOf(bars).iterator();
    }

    @Override
    public Optional<Bar> next() {
        return bars.hasNext() ? Optional.of(bars.next()) : Optional.empty();
    }
}
