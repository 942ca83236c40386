package com.quantflow.core.metrics;

import com.quantflow.core.TestBars;
import com.quantflow.core.TestOrders;
import com.quantflow.core.model.Direction;
import com.quantflow.core.portfolio.ClosedTrade;
import com.quantflow.core.portfolio.PortfolioState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Performance Metrics Tests")
class PerformanceMetricsTest {

    private static final double DELTA = 1e-9;
    private PerformanceMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new PerformanceMetrics(100_000);
    }

    private static ClosedTrade trade(String pnl) {
        return new ClosedTrade(TestBars.day(0), TestBars.day(1), 100, BigDecimal.TEN, BigDecimal.TEN,
            new BigDecimal(pnl), null);
    }

    @Test
    @DisplayName("Should track return and drawdown from the equity path")
    void testReturnAndDrawdown() {
        metrics.recordEquity(110_000);
        metrics.recordEquity(99_000);

        assertEquals(-0.01, metrics.getTotalReturn(), DELTA);
        assertEquals(0.1, metrics.getMaxDrawdown(), DELTA);
    }

    @Test
    @DisplayName("Should compute trade statistics")
    void testTradeStatistics() {
        metrics.recordTrade(trade("200"));
        metrics.recordTrade(trade("100"));
        metrics.recordTrade(trade("-100"));

        assertEquals(2.0 / 3.0, metrics.getWinRate(), DELTA);
        assertEquals(3.0, metrics.getProfitFactor(), DELTA);
        assertEquals(150.0, metrics.getAverageWin(), DELTA);
        assertEquals(-100.0, metrics.getAverageLoss(), DELTA);
        assertEquals(2, metrics.getWinningTrades());
        assertEquals(1, metrics.getLosingTrades());
    }

    @Test
    @DisplayName("Sharpe ratio is zero without variation and positive on a steady climb with noise")
    void testSharpe() {
        assertEquals(0.0, metrics.getSharpeRatio(), DELTA);

        double equity = 100_000;
        for (int i = 0; i < 20; i++) {
            equity *= i % 2 == 0 ? 1.01 : 0.999;
            metrics.recordEquity(equity);
        }
        assertTrue(metrics.getSharpeRatio() > 0);
        assertTrue(metrics.getAnnualizedReturn() > 0);
    }

    @Test
    @DisplayName("Report carries the computed values")
    void testReport() {
        metrics.recordEquity(105_000);
        metrics.recordTrade(trade("5000"));

        PerformanceReport report = metrics.toReport(new BigDecimal("100000"), new BigDecimal("105000"), 2);
        assertEquals(0.05, report.totalReturn(), DELTA);
        assertEquals(2, report.totalTrades());
        assertEquals(1, report.closedTrades());
        assertEquals(1.0, report.winRate(), DELTA);
        assertEquals(0.0, report.profitFactor(), DELTA);
    }

    @Test
    @DisplayName("Max drawdown of a run includes valuations at fill prices")
    void testRunDrawdownMatchesPortfolio() {
        PortfolioState portfolio = new PortfolioState("SPY", new BigDecimal("100000"));
        portfolio.markToMarket(TestBars.day(0), BigDecimal.TEN);
        portfolio.apply(TestOrders.fill("SPY", Direction.BUY, 5000, "10", "0", TestBars.day(0)));
        // a fill at 8 values the holding at 90000 before the bar closes back at 10
        portfolio.apply(TestOrders.fill("SPY", Direction.BUY, 100, "8", "0", TestBars.day(1)));
        portfolio.markToMarket(TestBars.day(1), BigDecimal.TEN);

        PerformanceReport report = PerformanceMetrics.of(portfolio)
            .toReport(portfolio.initialCapital(), portfolio.equity(), portfolio.fills().size());

        assertEquals(0.1, report.maxDrawdown(), DELTA);
        assertEquals(portfolio.maxDrawdown().doubleValue(), report.maxDrawdown(), DELTA);
        assertEquals(0.002, report.totalReturn(), DELTA);
    }
}
