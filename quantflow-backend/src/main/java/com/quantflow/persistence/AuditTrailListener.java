package com.quantflow.persistence;

import com.quantflow.core.engine.PipelineListener;
import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;
import com.quantflow.core.model.Signal;
import com.quantflow.core.portfolio.PortfolioSnapshot;
import com.quantflow.core.risk.RiskDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a run's actionable signals, vetoes, forced exits, fills and per-bar portfolio snapshots to
 * the {@link MarketDataStore}, keyed by run id.
 */
public final class AuditTrailListener implements PipelineListener {
    private static final Logger logger = LoggerFactory.getLogger(AuditTrailListener.class);

    static final String EXECUTION_FAILED = "execution-failed";

    private final MarketDataStore store;
    private final String runId;
    private final String instrument;

    public AuditTrailListener(MarketDataStore store, String runId, String instrument) {
        this.store = store;
        this.runId = runId;
        this.instrument = instrument;
        logger.info("Audit trail for run {} ({})", runId, instrument);
    }

    public String runId() {
        return runId;
    }

    @Override
    public void onSignal(Signal signal, IndicatorSnapshot snapshot) {
        if (signal.isActionable()) {
            store.recordSignal(runId, instrument, signal);
        }
    }

    @Override
    public void onDecision(RiskDecision decision) {
        if (decision instanceof RiskDecision.Vetoed vetoed) {
            store.recordRiskEvent(runId, instrument, vetoed.signal().timestamp(),
                vetoed.reason().tag(), vetoed.detail());
        } else if (decision instanceof RiskDecision.Approved approved && approved.orderIntent().isForcedExit()) {
            OrderIntent intent = approved.orderIntent();
            store.recordRiskEvent(runId, instrument, approved.signal().timestamp(),
                intent.exitTrigger().tag(), "sell " + intent.quantity() + " at " + intent.referencePrice());
        }
    }

    @Override
    public void onFill(Fill fill, PortfolioSnapshot portfolio) {
        store.recordFill(runId, fill);
    }

    @Override
    public void onExecutionFailure(OrderIntent intent, OrderExecutionException error) {
        store.recordRiskEvent(runId, instrument, intent.signal().timestamp(), EXECUTION_FAILED,
            intent.direction().side() + " " + intent.quantity() + ": " + error.getMessage());
    }

    @Override
    public void onBarClosed(Bar bar, PortfolioSnapshot portfolio) {
        store.recordSnapshot(runId, portfolio);
    }
}
