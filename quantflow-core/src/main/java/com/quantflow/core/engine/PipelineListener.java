package com.quantflow.core.engine;

import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioSnapshot;
import com.quantflow.core.risk.RiskDecision;

/**
 * Observer of pipeline events, for audit, metrics and reporting. Callbacks run on the driver thread
 * and must not mutate pipeline state.
 */
public interface PipelineListener {

    default void onRunStateChanged(RunState previous, RunState current) {
    }

    default void onSignal(Signal signal, IndicatorSnapshot snapshot) {
    }

    default void onDecision(RiskDecision decision) {
    }

    default void onFill(Fill fill, PortfolioSnapshot portfolio) {
    }

    default void onExecutionFailure(OrderIntent intent, OrderExecutionException error) {
    }

    default void onBarClosed(Bar bar, PortfolioSnapshot portfolio) {
    }
}
