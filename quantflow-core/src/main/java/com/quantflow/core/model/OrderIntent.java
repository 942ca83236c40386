package com.quantflow.core.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A risk-approved, not yet executed trade request.
 *
 * @param referencePrice close of the bar the decision was made on
 * @param exitTrigger    set when the intent is a forced protective exit, otherwise null
 */
public record OrderIntent(
    String instrument,
    Direction direction,
    long quantity,
    PriceReference priceReference,
    BigDecimal referencePrice,
    Signal signal,
    ExitTrigger exitTrigger
) {
    public OrderIntent {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(priceReference, "priceReference");
        Objects.requireNonNull(referencePrice, "referencePrice");
        Objects.requireNonNull(signal, "signal");
        if (direction != Direction.BUY && direction != Direction.SELL) {
            throw new IllegalArgumentException("Order intent must buy or sell, got " + direction);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
    }

    public Optional<ExitTrigger> exit() {
        return Optional.ofNullable(exitTrigger);
    }

    public boolean isForcedExit() {
        return exitTrigger != null;
    }

    public BigDecimal referenceNotional() {
        return referencePrice.multiply(BigDecimal.valueOf(quantity));
    }
}
