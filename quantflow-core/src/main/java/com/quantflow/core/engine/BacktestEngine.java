package com.quantflow.core.engine;

import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.error.MarketDataException;
import com.quantflow.core.execution.SimulatedExecutionAdapter;
import com.quantflow.core.model.Bar;
import com.quantflow.core.portfolio.ClosedTrade;
import com.quantflow.core.portfolio.EquityPoint;
import com.quantflow.core.portfolio.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Historical backtests over stored bars, run through the same {@link ReplayDriver} as live trading.
 */
public final class BacktestEngine {
    private static final Logger logger = LoggerFactory.getLogger(BacktestEngine.class);

    /**
     * @param from first trading day, inclusive
     * @param to   last trading day, inclusive
     */
    public record BacktestRequest(String instrument, LocalDate from, LocalDate to, BigDecimal initialCapital) {
        public BacktestRequest {
            Objects.requireNonNull(instrument, "instrument");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            if (to.isBefore(from)) {
                throw new IllegalArgumentException("Backtest range ends before it starts: " + from + " > " + to);
            }
        }
    }

    public record BacktestReport(
        BacktestRequest request,
        ReplayResult result,
        List<EquityPoint> equityCurve,
        List<ClosedTrade> trades,
        double buyAndHoldReturn
    ) {
        public BacktestReport {
            equityCurve = List.copyOf(equityCurve);
            trades = List.copyOf(trades);
        }
    }

    private final PipelineConfig baseConfig;
    private final BarRepository repository;
    private final List<PipelineListener> listeners = new ArrayList<>();

    public BacktestEngine(PipelineConfig baseConfig, BarRepository repository) {
        this.baseConfig = baseConfig;
        this.repository = repository;
    }

    public BacktestEngine addListener(PipelineListener listener) {
        listeners.add(listener);
        return this;
    }

    public BacktestReport run(BacktestRequest request) {
        PipelineConfig config = baseConfig.toBuilder()
            .instrument(request.instrument())
            .initialCapital(request.initialCapital() != null ? request.initialCapital() : baseConfig.initialCapital())
            .build();

        Instant from = request.from().atStartOfDay(config.zone()).toInstant();
        Instant to = request.to().plusDays(1).atStartOfDay(config.zone()).toInstant();
        List<Bar> bars = repository.findBars(config.instrument(), from, to);
        if (bars.isEmpty()) {
            throw new MarketDataException("No bars stored for " + config.instrument()
                + " between " + request.from() + " and " + request.to());
        }
        logger.info("Backtesting {} over {} bars ({} to {}) with capital {}", config.instrument(), bars.size(),
            request.from(), request.to(), String.format("%.2f", config.initialCapital()));

        PortfolioState portfolio = new PortfolioState(config.instrument(), config.initialCapital());
        ReplayDriver driver = new ReplayDriver(config, new HistoricalBarSource(bars),
            new SimulatedExecutionAdapter(config.execution(), portfolio), portfolio);
        listeners.forEach(driver::addListener);

        ReplayResult result = driver.run();
        double benchmark = buyAndHold(bars);
        logger.info("Backtest {} finished: return {}% vs buy & hold {}%", config.instrument(),
            String.format("%.2f", result.performance().totalReturn() * 100), String.format("%.2f", benchmark * 100));
        return new BacktestReport(request, result, portfolio.equityCurve(), portfolio.closedTrades(), benchmark);
    }

    static double buyAndHold(List<Bar> bars) {
        BigDecimal first = bars.get(0).close();
        BigDecimal last = bars.get(bars.size() - 1).close();
        return last.subtract(first).divide(first, MathContext.DECIMAL64).doubleValue();
    }
}
