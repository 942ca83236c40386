package com.quantflow.core.config;

import java.math.BigDecimal;

/**
 * Risk limits and position sizing parameters. Ratios are decimals (0.05 = 5%).
 */
public record RiskSettings(
    SizingMethod sizingMethod,
    BigDecimal tradeAmount,
    BigDecimal minTradeAmount,
    BigDecimal maxTradeAmount,
    BigDecimal positionRatio,
    BigDecimal maxPositionFraction,
    BigDecimal kellyFraction,
    int kellyMinTrades,
    int kellyLookbackTrades,
    BigDecimal riskPerTrade,
    BigDecimal atrMultiplier,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal trailingStop,
    BigDecimal maxDrawdown,
    BigDecimal maxDailyLoss,
    int maxTradesPerDay
) {
    public boolean trailingStopEnabled() {
        return trailingStop.signum() > 0;
    }
}
