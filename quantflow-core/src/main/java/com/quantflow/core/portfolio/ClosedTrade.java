package com.quantflow.core.portfolio;

import com.quantflow.core.model.ExitTrigger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Optional;

/**
 * Realized outcome of a sell against the open position.
 *
 * @param profitLoss net of the sell commission and the matching share of the entry commission
 */
public record ClosedTrade(
    Instant entryTime,
    Instant exitTime,
    long quantity,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal profitLoss,
    ExitTrigger exitTrigger
) {
    public boolean isWin() {
        return profitLoss.signum() > 0;
    }

    public Optional<ExitTrigger> exit() {
        return Optional.ofNullable(exitTrigger);
    }

    /** Return on the capital committed to the closed quantity. */
    public double returnRatio() {
        BigDecimal cost = entryPrice.multiply(BigDecimal.valueOf(quantity));
        return cost.signum() == 0 ? 0.0 : profitLoss.divide(cost, MathContext.DECIMAL64).doubleValue();
    }
}
