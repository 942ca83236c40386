package com.quantflow.metrics;

import com.quantflow.core.engine.PipelineListener;
import com.quantflow.core.engine.RunState;
import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioSnapshot;
import com.quantflow.core.risk.RiskDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline counters and gauges, tagged by instrument.
 *
 * Provides:
 * - pipeline.signals (direction), pipeline.vetoes (reason), pipeline.forced.exits (trigger)
 * - pipeline.fills (side), pipeline.execution.failures (timeout)
 * - pipeline.bars, pipeline.equity and pipeline.drawdown gauges
 */
public final class PipelineMetrics implements PipelineListener {
    private static final Logger logger = LoggerFactory.getLogger(PipelineMetrics.class);

    private final MeterRegistry registry;
    private final String instrument;
    private final Counter bars;

    private volatile double equity;
    private volatile double drawdown;

    public PipelineMetrics(MeterRegistry registry, String instrument) {
        this.registry = registry;
        this.instrument = instrument;
        this.bars = registry.counter("pipeline.bars", "instrument", instrument);
        Gauge.builder("pipeline.equity", this, m -> m.equity)
            .tag("instrument", instrument)
            .register(registry);
        Gauge.builder("pipeline.drawdown", this, m -> m.drawdown)
            .tag("instrument", instrument)
            .register(registry);
    }

    @Override
    public void onSignal(Signal signal, IndicatorSnapshot snapshot) {
        if (signal.isActionable()) {
            registry.counter("pipeline.signals",
                "instrument", instrument,
                "direction", signal.direction().side()).increment();
        }
    }

    @Override
    public void onDecision(RiskDecision decision) {
        if (decision instanceof RiskDecision.Vetoed vetoed) {
            registry.counter("pipeline.vetoes",
                "instrument", instrument,
                "reason", vetoed.reason().tag()).increment();
        } else if (decision instanceof RiskDecision.Approved approved && approved.orderIntent().isForcedExit()) {
            registry.counter("pipeline.forced.exits",
                "instrument", instrument,
                "trigger", approved.orderIntent().exitTrigger().tag()).increment();
        }
    }

    @Override
    public void onFill(Fill fill, PortfolioSnapshot portfolio) {
        registry.counter("pipeline.fills",
            "instrument", instrument,
            "side", fill.direction().side()).increment();
    }

    @Override
    public void onExecutionFailure(OrderIntent intent, OrderExecutionException error) {
        registry.counter("pipeline.execution.failures",
            "instrument", instrument,
            "timeout", Boolean.toString(error.isTimeout())).increment();
    }

    @Override
    public void onBarClosed(Bar bar, PortfolioSnapshot portfolio) {
        bars.increment();
        equity = portfolio.equity().doubleValue();
        drawdown = portfolio.drawdown().doubleValue();
    }

    @Override
    public void onRunStateChanged(RunState previous, RunState current) {
        if (current == RunState.COMPLETED || current == RunState.FAILED) {
            logSummary();
        }
    }

    public double count(String name, String tagKey, String tagValue) {
        Counter counter = registry.find(name).tag("instrument", instrument).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }

    public double total(String name) {
        return registry.find(name).tag("instrument", instrument).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    private void logSummary() {
        logger.info("{}: {} bars, {} signals, {} vetoes, {} fills, {} execution failures", instrument,
            (long) bars.count(), (long) total("pipeline.signals"), (long) total("pipeline.vetoes"),
            (long) total("pipeline.fills"), (long) total("pipeline.execution.failures"));
        for (Meter meter : registry.find("pipeline.vetoes").tag("instrument", instrument).meters()) {
            logger.debug("  {} = {}", meter.getId().getTag("reason"), meter.measure().iterator().next().getValue());
        }
    }
}
