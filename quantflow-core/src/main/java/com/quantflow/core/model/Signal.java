package com.quantflow.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Directional output of a strategy for one bar. Produced once, never mutated.
 */
public record Signal(
    Instant timestamp,
    Direction direction,
    double strength,
    String strategy,
    String reason
) {
    public Signal {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(strategy, "strategy");
        if (strength < 0.0 || strength > 1.0 || Double.isNaN(strength)) {
            throw new IllegalArgumentException("Signal strength must be within [0,1]: " + strength);
        }
        reason = reason == null ? "" : reason;
    }

    public static Signal hold(Instant timestamp, String strategy, String reason) {
        return new Signal(timestamp, Direction.HOLD, 0.0, strategy, reason);
    }

    public SignalGrade grade() {
        return SignalGrade.of(strength);
    }

    public boolean isActionable() {
        return direction != Direction.HOLD;
    }
}
