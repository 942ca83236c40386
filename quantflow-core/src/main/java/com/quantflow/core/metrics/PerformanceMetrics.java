package com.quantflow.core.metrics;

import com.quantflow.core.portfolio.ClosedTrade;
import com.quantflow.core.portfolio.EquityPoint;
import com.quantflow.core.portfolio.PortfolioState;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Performance statistics over an equity curve and the realized trades of a run.
 * Sharpe ratio and annualized return treat each equity step as one trading period.
 */
public final class PerformanceMetrics {
    private static final double RISK_FREE_RATE = 0.03; // 3% annual risk-free rate
    private static final int TRADING_DAYS_PER_YEAR = 252;

    private final List<ClosedTrade> trades = new ArrayList<>();
    private final List<Double> periodReturns = new ArrayList<>();

    private final double initialCapital;
    private double currentEquity;
    private double peakEquity;
    private double maxDrawdown;

    public PerformanceMetrics(double initialCapital) {
        this.initialCapital = initialCapital;
        this.currentEquity = initialCapital;
        this.peakEquity = initialCapital;
    }

    /**
     * Metrics for a finished run. Returns use one equity point per timestamp; max drawdown is the
     * portfolio's own, which also sees valuations at fill prices.
     */
    public static PerformanceMetrics of(PortfolioState portfolio) {
        PerformanceMetrics metrics = new PerformanceMetrics(portfolio.initialCapital().doubleValue());
        List<EquityPoint> curve = portfolio.equityCurve();
        for (int i = 0; i < curve.size(); i++) {
            // one observation per timestamp: the last valuation wins
            if (i + 1 < curve.size() && curve.get(i + 1).timestamp().equals(curve.get(i).timestamp())) {
                continue;
            }
            metrics.recordEquity(curve.get(i).equity().doubleValue());
        }
        portfolio.closedTrades().forEach(metrics::recordTrade);
        metrics.maxDrawdown = portfolio.maxDrawdown().doubleValue();
        return metrics;
    }

    public void recordEquity(double equity) {
        if (currentEquity != 0) {
            periodReturns.add((equity - currentEquity) / currentEquity);
        }
        currentEquity = equity;
        if (equity > peakEquity) {
            peakEquity = equity;
        } else {
            maxDrawdown = Math.max(maxDrawdown, (peakEquity - equity) / peakEquity);
        }
    }

    public void recordTrade(ClosedTrade trade) {
        trades.add(trade);
    }

    public double getTotalReturn() {
        return (currentEquity - initialCapital) / initialCapital;
    }

    public double getAnnualizedReturn() {
        if (periodReturns.isEmpty()) return 0.0;
        var avgReturn = periodReturns.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        return Math.pow(1 + avgReturn, TRADING_DAYS_PER_YEAR) - 1;
    }

    public double getSharpeRatio() {
        if (periodReturns.size() < 2) return 0.0;

        var avgReturn = periodReturns.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);

        var variance = periodReturns.stream()
                .mapToDouble(r -> Math.pow(r - avgReturn, 2))
                .average()
                .orElse(0.0);

        var stdDev = Math.sqrt(variance);
        if (stdDev == 0) return 0.0;

        var periodRiskFreeRate = RISK_FREE_RATE / TRADING_DAYS_PER_YEAR;
        return ((avgReturn - periodRiskFreeRate) / stdDev) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    public double getMaxDrawdown() {
        return maxDrawdown;
    }

    public double getWinRate() {
        if (trades.isEmpty()) return 0.0;
        return (double) getWinningTrades() / trades.size();
    }

    public int getWinningTrades() {
        return (int) trades.stream().filter(ClosedTrade::isWin).count();
    }

    public int getLosingTrades() {
        return (int) trades.stream().filter(t -> t.profitLoss().signum() < 0).count();
    }

    public double getProfitFactor() {
        var grossProfit = trades.stream()
                .filter(ClosedTrade::isWin)
                .mapToDouble(t -> t.profitLoss().doubleValue())
                .sum();

        var grossLoss = Math.abs(trades.stream()
                .filter(t -> t.profitLoss().signum() < 0)
                .mapToDouble(t -> t.profitLoss().doubleValue())
                .sum());

        return grossLoss == 0 ? 0.0 : grossProfit / grossLoss;
    }

    public double getAverageWin() {
        return trades.stream()
                .filter(ClosedTrade::isWin)
                .mapToDouble(t -> t.profitLoss().doubleValue())
                .average()
                .orElse(0.0);
    }

    public double getAverageLoss() {
        return trades.stream()
                .filter(t -> t.profitLoss().signum() < 0)
                .mapToDouble(t -> t.profitLoss().doubleValue())
                .average()
                .orElse(0.0);
    }

    public PerformanceReport toReport(BigDecimal initial, BigDecimal finalEquity, int totalFills) {
        return new PerformanceReport(initial, finalEquity, getTotalReturn(), getAnnualizedReturn(),
            getMaxDrawdown(), getSharpeRatio(), getWinRate(), getProfitFactor(), getAverageWin(),
            getAverageLoss(), getWinningTrades(), getLosingTrades(), totalFills, trades.size());
    }
}
