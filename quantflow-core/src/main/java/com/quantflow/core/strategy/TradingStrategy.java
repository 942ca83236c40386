package com.quantflow.core.strategy;

import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Signal;

/**
 * Turns the indicator snapshot of the latest bar into a directional signal.
 * Implementations keep no state of their own; crossing memory lives in the {@link SignalContext}.
 */
public interface TradingStrategy {

    String name();

    Signal evaluate(IndicatorSnapshot snapshot, SignalContext context);
}
