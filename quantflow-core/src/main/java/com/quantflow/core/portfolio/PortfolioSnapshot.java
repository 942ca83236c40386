package com.quantflow.core.portfolio;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only copy of the portfolio at a point in time, for audit and reporting.
 */
public record PortfolioSnapshot(
    Instant timestamp,
    String instrument,
    BigDecimal cash,
    long position,
    BigDecimal averageCost,
    BigDecimal lastPrice,
    BigDecimal equity,
    BigDecimal peakEquity,
    BigDecimal drawdown,
    BigDecimal realizedPnl
) {
}
