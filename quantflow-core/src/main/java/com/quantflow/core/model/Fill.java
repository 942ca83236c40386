package com.quantflow.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * What actually happened when an intent was executed, live or simulated.
 */
public record Fill(
    OrderIntent intent,
    BigDecimal price,
    long quantity,
    BigDecimal commission,
    Instant timestamp
) {
    public Fill {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(commission, "commission");
        Objects.requireNonNull(timestamp, "timestamp");
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Fill price must be positive: " + price);
        }
        if (quantity <= 0 || quantity > intent.quantity()) {
            throw new IllegalArgumentException("Fill quantity " + quantity
                + " outside (0, " + intent.quantity() + "]");
        }
        if (commission.signum() < 0) {
            throw new IllegalArgumentException("Commission cannot be negative: " + commission);
        }
    }

    public Direction direction() {
        return intent.direction();
    }

    public String instrument() {
        return intent.instrument();
    }

    public BigDecimal notional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
