package com.quantflow.core.engine;

import com.quantflow.core.config.FillTiming;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.error.MarketDataException;
import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.execution.ExecutionAdapter;
import com.quantflow.core.indicator.IndicatorEngine;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.metrics.PerformanceMetrics;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioState;
import com.quantflow.core.risk.RiskController;
import com.quantflow.core.risk.RiskDecision;
import com.quantflow.core.risk.RiskLimitState;
import com.quantflow.core.risk.VetoReason;
import com.quantflow.core.strategy.SignalContext;
import com.quantflow.core.strategy.Strategies;
import com.quantflow.core.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one instrument's pipeline bar by bar: indicators, signal, risk gate, execution, portfolio.
 *
 * <p>The loop is the same for historical replay and live trading; only the {@link BarSource} and
 * {@link ExecutionAdapter} differ. Bars must arrive with strictly increasing timestamps. Any runtime
 * fault marks the run {@link RunState#FAILED} and is rethrown; bars are never skipped.
 *
 * <p>With {@link FillTiming#NEXT_BAR_OPEN} an approved intent is held until the next bar arrives and
 * executed before that bar is evaluated. An intent still pending at end of stream is discarded.
 *
 * <p>A driver runs once. {@link #requestStop()} may be called from any thread; the bar in flight is
 * finished before the loop exits.
 */
public final class ReplayDriver {
    private static final Logger logger = LoggerFactory.getLogger(ReplayDriver.class);

    private final PipelineConfig config;
    private final BarSource barSource;
    private final ExecutionAdapter executionAdapter;
    private final PortfolioState portfolio;
    private final TradingStrategy strategy;
    private final IndicatorEngine indicators;
    private final RiskController riskController;
    private final RiskLimitState limits;
    private final SignalContext context = new SignalContext();
    private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private final Map<VetoReason, Integer> vetoes = new EnumMap<>(VetoReason.class);
    private volatile RunState state = RunState.INITIALIZED;
    private OrderIntent pendingIntent;
    private Instant lastTimestamp;
    private long barsProcessed;
    private int actionableSignals;
    private int executionFailures;

    public ReplayDriver(PipelineConfig config, BarSource barSource, ExecutionAdapter executionAdapter,
                        PortfolioState portfolio) {
        this(config, barSource, executionAdapter, portfolio, Strategies.create(config.strategy()));
    }

    public ReplayDriver(PipelineConfig config, BarSource barSource, ExecutionAdapter executionAdapter,
                        PortfolioState portfolio, TradingStrategy strategy) {
        if (!config.instrument().equals(portfolio.instrument())) {
            throw new IllegalArgumentException("Portfolio tracks " + portfolio.instrument()
                + " but pipeline is configured for " + config.instrument());
        }
        this.config = config;
        this.barSource = barSource;
        this.executionAdapter = executionAdapter;
        this.portfolio = portfolio;
        this.strategy = strategy;
        this.indicators = new IndicatorEngine(config.indicators());
        this.riskController = new RiskController(config.risk(), config.execution(), config.instrument(), config.zone());
        this.limits = new RiskLimitState(portfolio.equity());
    }

    public ReplayDriver addListener(PipelineListener listener) {
        listeners.add(listener);
        return this;
    }

    public RunState state() {
        return state;
    }

    public PortfolioState portfolio() {
        return portfolio;
    }

    public RiskLimitState limits() {
        return limits;
    }

    /**
     * Ask the loop to halt after the bar currently being processed.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("{}: stop requested", config.instrument());
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Feed history through the indicator engine and strategy before {@link #run()}, so that the first
     * bar of a live feed is evaluated with defined indicators and crossing memory. Warm-up bars never
     * reach the risk controller, the execution adapter or the portfolio.
     *
     * @return number of history bars consumed
     */
    public int warmUp(List<Bar> history) {
        if (state != RunState.INITIALIZED) {
            throw new IllegalStateException("Warm-up must precede the run, state is " + state);
        }
        for (Bar bar : history) {
            if (lastTimestamp != null && !bar.timestamp().isAfter(lastTimestamp)) {
                throw new MarketDataException("Bar at " + bar.timestamp() + " does not follow " + lastTimestamp);
            }
            lastTimestamp = bar.timestamp();
            Optional<IndicatorSnapshot> snapshot = indicators.append(bar);
            snapshot.ifPresent(s -> {
                strategy.evaluate(s, context);
                context.record(s);
            });
        }
        logger.info("{}: warmed up on {} bars, last {}", config.instrument(), history.size(), lastTimestamp);
        return history.size();
    }

    public ReplayResult run() {
        if (state != RunState.INITIALIZED) {
            throw new IllegalStateException("Run already started, state is " + state);
        }
        transition(RunState.RUNNING);
        logger.info("{}: starting {} run with strategy {} and capital {}", config.instrument(),
            executionAdapter.mode(), strategy.name(), String.format("%.2f", portfolio.initialCapital()));

        try {
            while (!stopRequested.get()) {
                Optional<Bar> next = barSource.next();
                if (next.isEmpty()) {
                    break;
                }
                processBar(next.get());
            }
        } catch (RuntimeException e) {
            logger.error("{}: run failed after {} bars: {}", config.instrument(), barsProcessed, e.getMessage());
            transition(RunState.FAILED);
            throw e;
        }

        if (pendingIntent != null) {
            logger.info("{}: discarding pending {} intent for {} at end of stream", config.instrument(),
                pendingIntent.direction(), pendingIntent.quantity());
            pendingIntent = null;
        }

        transition(RunState.COMPLETED);
        PerformanceMetrics metrics = PerformanceMetrics.of(portfolio);
        ReplayResult result = new ReplayResult(state, barsProcessed, actionableSignals, vetoes,
            executionFailures, portfolio.fills(), portfolio.snapshot(),
            metrics.toReport(portfolio.initialCapital(), portfolio.equity(), portfolio.fills().size()),
            stopRequested.get());
        logger.info("{}: run completed, {} bars, {} fills, equity {}", config.instrument(), barsProcessed,
            result.fills().size(), String.format("%.2f", portfolio.equity()));
        return result;
    }

    private void processBar(Bar bar) {
        if (lastTimestamp != null && !bar.timestamp().isAfter(lastTimestamp)) {
            throw new MarketDataException("Bar at " + bar.timestamp() + " does not follow " + lastTimestamp);
        }
        lastTimestamp = bar.timestamp();
        riskController.startBar(bar, portfolio, limits);

        if (pendingIntent != null) {
            OrderIntent intent = pendingIntent;
            pendingIntent = null;
            execute(intent, bar);
        }

        Optional<IndicatorSnapshot> snapshot = indicators.append(bar);
        portfolio.markToMarket(bar.timestamp(), bar.close());

        Signal signal = snapshot
            .map(s -> strategy.evaluate(s, context))
            .orElseGet(() -> Signal.hold(bar.timestamp(), strategy.name(), "warming up"));
        if (signal.isActionable()) {
            actionableSignals++;
            logger.info("{}: {} signal ({}, strength {}) {}", config.instrument(), signal.direction(),
                signal.grade(), String.format("%.2f", signal.strength()), signal.reason());
        }
        snapshot.ifPresent(s -> listeners.forEach(l -> l.onSignal(signal, s)));

        RiskDecision decision = riskController.evaluate(signal, bar, snapshot, portfolio, limits);
        listeners.forEach(l -> l.onDecision(decision));
        if (decision instanceof RiskDecision.Vetoed vetoed) {
            vetoes.merge(vetoed.reason(), 1, Integer::sum);
        }

        decision.intent().ifPresent(intent -> {
            if (config.execution().fillTiming() == FillTiming.SAME_BAR_CLOSE) {
                execute(intent, bar);
            } else {
                pendingIntent = intent;
            }
        });

        snapshot.ifPresent(context::record);
        barsProcessed++;
        listeners.forEach(l -> l.onBarClosed(bar, portfolio.snapshot()));
    }

    private void execute(OrderIntent intent, Bar bar) {
        Fill fill;
        try {
            fill = executionAdapter.execute(intent, bar);
        } catch (OrderExecutionException e) {
            executionFailures++;
            if (e.isTimeout()) {
                logger.warn("{}: {} order timed out, position unchanged: {}", config.instrument(),
                    intent.direction(), e.getMessage());
            } else {
                logger.warn("{}: {} order failed, position unchanged: {}", config.instrument(),
                    intent.direction(), e.getMessage());
            }
            listeners.forEach(l -> l.onExecutionFailure(intent, e));
            return;
        }

        BigDecimal realized = portfolio.apply(fill);
        riskController.recordFill(fill, realized, portfolio, limits);
        logger.info("{}: filled {} {} @ {} (commission {}){}", config.instrument(), fill.direction(),
            fill.quantity(), String.format("%.2f", fill.price()), String.format("%.2f", fill.commission()),
            fill.direction() == Direction.SELL ? ", realized " + String.format("%.2f", realized) : "");
        listeners.forEach(l -> l.onFill(fill, portfolio.snapshot()));
    }

    private void transition(RunState next) {
        RunState previous = state;
        state = next;
        listeners.forEach(l -> l.onRunStateChanged(previous, next));
    }
}
