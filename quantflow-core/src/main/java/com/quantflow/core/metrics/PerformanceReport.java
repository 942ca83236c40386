package com.quantflow.core.metrics;

import java.math.BigDecimal;

/**
 * Summary metrics of a run. Ratios are decimals; money values are in account currency.
 *
 * @param totalTrades  fills executed
 * @param closedTrades sells that realized a profit or loss
 */
public record PerformanceReport(
    BigDecimal initialCapital,
    BigDecimal finalEquity,
    double totalReturn,
    double annualizedReturn,
    double maxDrawdown,
    double sharpeRatio,
    double winRate,
    double profitFactor,
    double averageWin,
    double averageLoss,
    int winningTrades,
    int losingTrades,
    int totalTrades,
    int closedTrades
) {
}
