package com.quantflow.core.engine;

import com.quantflow.core.metrics.PerformanceReport;
import com.quantflow.core.model.Fill;
import com.quantflow.core.portfolio.PortfolioSnapshot;
import com.quantflow.core.risk.VetoReason;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed run.
 *
 * @param stopped true when the run ended on a stop request rather than end of stream
 */
public record ReplayResult(
    RunState state,
    long barsProcessed,
    int actionableSignals,
    Map<VetoReason, Integer> vetoes,
    int executionFailures,
    List<Fill> fills,
    PortfolioSnapshot finalPortfolio,
    PerformanceReport performance,
    boolean stopped
) {
    public ReplayResult {
        vetoes = Map.copyOf(vetoes);
        fills = List.copyOf(fills);
    }

    public int totalVetoes() {
        return vetoes.values().stream().mapToInt(Integer::intValue).sum();
    }
}
