package com.quantflow.core.strategy;

import com.quantflow.core.config.StrategySettings;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Buys when the trailing price change and the volume change both exceed their thresholds,
 * sells when the price change reverses past the negative threshold.
 * Each regime fires once on entry, not on every bar it persists.
 */
public final class MomentumStrategy implements TradingStrategy {

    public static final String NAME = "momentum";
    static final String UP_REGIME = "momentum.up";
    static final String DOWN_REGIME = "momentum.down";

    private static final double STRONG = 0.8;
    private static final double NORMAL = 0.6;

    private final StrategySettings settings;

    public MomentumStrategy(StrategySettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Signal evaluate(IndicatorSnapshot snapshot, SignalContext context) {
        Optional<BigDecimal> momentum = snapshot.momentum();
        Optional<BigDecimal> volumeRatio = snapshot.volumeRatio();
        if (momentum.isEmpty() || volumeRatio.isEmpty()) {
            return Signal.hold(snapshot.timestamp(), NAME, "momentum not yet defined");
        }
        BigDecimal priceChange = momentum.get();
        BigDecimal volumeChange = volumeRatio.get().subtract(BigDecimal.ONE);

        boolean up = priceChange.compareTo(settings.momentumThreshold()) > 0
            && volumeChange.compareTo(settings.volumeChangeThreshold()) > 0;
        boolean down = priceChange.compareTo(settings.momentumThreshold().negate()) < 0;

        CrossingState crossings = context.crossings();
        boolean enteredUp = crossings.activates(UP_REGIME, up);
        boolean enteredDown = crossings.activates(DOWN_REGIME, down);

        String detail = "change " + percent(priceChange) + ", volume " + percent(volumeChange);
        if (enteredUp) {
            return new Signal(snapshot.timestamp(), Direction.BUY, strength(priceChange), NAME, "upward momentum, " + detail);
        }
        if (enteredDown) {
            return new Signal(snapshot.timestamp(), Direction.SELL, strength(priceChange), NAME, "momentum reversal, " + detail);
        }
        return Signal.hold(snapshot.timestamp(), NAME, detail);
    }

    private double strength(BigDecimal priceChange) {
        return priceChange.abs().compareTo(settings.strongMomentumThreshold()) >= 0 ? STRONG : NORMAL;
    }

    private static String percent(BigDecimal ratio) {
        return ratio.movePointRight(2).setScale(2, RoundingMode.HALF_UP) + "%";
    }
}
