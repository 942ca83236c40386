package com.quantflow.live;

import com.quantflow.broker.BrokerClient;
import com.quantflow.config.TradingConfig;
import com.quantflow.core.config.FillTiming;
import com.quantflow.core.config.PipelineConfig;
import com.quantflow.core.engine.PipelineListener;
import com.quantflow.core.engine.ReplayDriver;
import com.quantflow.core.engine.ReplayResult;
import com.quantflow.core.model.Bar;
import com.quantflow.core.portfolio.PortfolioState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pipeline against the broker: a {@link PollingBarSource} feeds the same
 * {@link ReplayDriver} a backtest uses, with a {@link LiveExecutionAdapter} in place of simulated fills.
 *
 * <p>Live orders execute on the bar that produced them, at the broker's price. Indicators are warmed
 * up on recent history before the first live bar. {@link #stop()} is safe to call from a shutdown
 * hook; the bar in flight completes first, and {@link #awaitTermination(Duration)} waits for it.
 */
public final class LiveTrader {
    private static final Logger logger = LoggerFactory.getLogger(LiveTrader.class);
    private static final int HISTORY_CALENDAR_FACTOR = 2;
    // Covers overnight and weekend gaps between intraday sessions
    private static final Duration MIN_INTRADAY_HISTORY = Duration.ofDays(7);

    private final PipelineConfig pipeline;
    private final BrokerClient broker;
    private final TradingSessionFilter session;
    private final PollingBarSource source;
    private final LiveExecutionAdapter adapter;
    private final ReplayDriver driver;
    private final Clock clock;
    private final CountDownLatch terminated = new CountDownLatch(1);

    public LiveTrader(TradingConfig config, BrokerClient broker, Clock clock) {
        PipelineConfig configured = config.toPipelineConfig();
        if (configured.execution().fillTiming() != FillTiming.SAME_BAR_CLOSE) {
            logger.info("Live orders execute on the signal bar; ignoring fill timing {}",
                configured.execution().fillTiming());
        }
        this.pipeline = configured.toBuilder().fillTiming(FillTiming.SAME_BAR_CLOSE).build();
        this.broker = broker;
        this.clock = clock;
        this.session = new TradingSessionFilter(pipeline.zone(), config.getSessionOpen(), config.getSessionClose(),
            TradingSessionFilter.barDuration(config.getBarTimeframe()));

        String instrument = pipeline.instrument();
        PortfolioState portfolio = new PortfolioState(instrument, pipeline.initialCapital());
        long held = broker.getPositionQuantity(instrument);
        if (held != 0) {
            logger.warn("{}: broker reports {} shares already held; they are not tracked by this run", instrument, held);
        }

        List<Bar> history = loadHistory();
        Instant after = history.isEmpty() ? null : history.get(history.size() - 1).timestamp();
        this.source = new PollingBarSource(broker, instrument, session, config.getBarPollInterval(), after, clock);
        this.adapter = new LiveExecutionAdapter(broker, pipeline.execution(), config.getOrderTimeout(),
            config.getFillPollInterval());
        this.driver = new ReplayDriver(pipeline, source, adapter, portfolio);
        driver.warmUp(history);
    }

    public LiveTrader addListener(PipelineListener listener) {
        driver.addListener(listener);
        return this;
    }

    public PipelineConfig pipelineConfig() {
        return pipeline;
    }

    public ReplayDriver driver() {
        return driver;
    }

    /**
     * Block until {@link #stop()} is called or the run fails.
     */
    public ReplayResult run() {
        logger.info("{}: live trading started", pipeline.instrument());
        try {
            return driver.run();
        } finally {
            source.close();
            adapter.close();
            terminated.countDown();
        }
    }

    /**
     * Wait for {@link #run()} to return, so that a stopping process lets the bar in flight finish.
     *
     * @return false if the run is still going after {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        logger.info("{}: live trading stopping", pipeline.instrument());
        driver.requestStop();
        source.close();
    }

    // Most recent completed in-session bars, enough to define every indicator
    private List<Bar> loadHistory() {
        Instant now = clock.instant();
        int window = pipeline.indicators().window();
        Duration span = session.barDuration().multipliedBy((long) window * HISTORY_CALENDAR_FACTOR);
        if (session.isIntraday() && span.compareTo(MIN_INTRADAY_HISTORY) < 0) {
            span = MIN_INTRADAY_HISTORY;
        }
        Instant from = now.minus(span);
        List<Bar> bars = broker.getBars(pipeline.instrument(), from, now).stream()
            .filter(bar -> session.isComplete(bar.timestamp(), now))
            .filter(session::accepts)
            .toList();
        List<Bar> history = bars.size() > window ? bars.subList(bars.size() - window, bars.size()) : bars;
        logger.info("{}: loaded {} history bars for warm-up", pipeline.instrument(), history.size());
        return history;
    }
}
