package com.quantflow.core.strategy;

import com.quantflow.core.config.StrategySettings;
import com.quantflow.core.indicator.BollingerBands;
import com.quantflow.core.indicator.IndicatorSnapshot;
import com.quantflow.core.indicator.MacdValue;
import com.quantflow.core.model.Direction;
import com.quantflow.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rule-based strategy over moving averages, RSI, MACD, Bollinger bands and volume.
 *
 * <p>Each sub-signal is evaluated for both directions. A buy fires when every condition in
 * {@code buyRequires} holds; a sell fires when every condition in {@code sellRequires} holds or,
 * if enabled, RSI is above the overbought level. The signal strength is the summed weight of all
 * conditions that agree with the chosen direction, so optional conditions only add confidence.
 *
 * <p>Crossing conditions (MA, MACD) fire on the crossing bar only.
 */
public final class TechnicalRuleStrategy implements TradingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(TechnicalRuleStrategy.class);

    public static final String NAME = "technical";
    static final String MA_PAIR = "ma_short/ma_long";
    static final String MACD_PAIR = "macd_line/macd_signal";

    private final StrategySettings settings;

    public TechnicalRuleStrategy(StrategySettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Signal evaluate(IndicatorSnapshot snapshot, SignalContext context) {
        CrossingState crossings = context.crossings();
        Set<TechnicalCondition> buy = EnumSet.noneOf(TechnicalCondition.class);
        Set<TechnicalCondition> sell = EnumSet.noneOf(TechnicalCondition.class);
        List<String> buyReasons = new ArrayList<>();
        List<String> sellReasons = new ArrayList<>();

        // Crossing memory is updated every bar, whether or not a signal results
        Optional<BigDecimal> shortMa = snapshot.shortMa();
        Optional<BigDecimal> longMa = snapshot.longMa();
        if (shortMa.isPresent() && longMa.isPresent()) {
            Crossing cross = crossings.update(MA_PAIR, shortMa.get(), longMa.get());
            if (cross == Crossing.UP) {
                buy.add(TechnicalCondition.MA_CROSS);
                buyReasons.add("MA golden cross");
            } else if (cross == Crossing.DOWN) {
                sell.add(TechnicalCondition.MA_CROSS);
                sellReasons.add("MA death cross");
            }
        }

        Optional<MacdValue> macd = snapshot.macd();
        if (macd.isPresent()) {
            Crossing cross = crossings.update(MACD_PAIR, macd.get().line(), macd.get().signal());
            if (cross == Crossing.UP) {
                buy.add(TechnicalCondition.MACD_CROSS);
                buyReasons.add("MACD crossed above signal");
            } else if (cross == Crossing.DOWN) {
                sell.add(TechnicalCondition.MACD_CROSS);
                sellReasons.add("MACD crossed below signal");
            }
        }

        boolean overbought = false;
        Optional<BigDecimal> rsi = snapshot.rsi();
        if (rsi.isPresent()) {
            BigDecimal value = rsi.get();
            if (value.compareTo(settings.rsiOverbought()) < 0) {
                buy.add(TechnicalCondition.RSI);
            }
            if (value.compareTo(settings.rsiOversold()) > 0) {
                sell.add(TechnicalCondition.RSI);
            }
            overbought = value.compareTo(settings.rsiOverbought()) > 0;
            if (overbought) {
                sellReasons.add("RSI overbought " + value.setScale(1, RoundingMode.HALF_UP));
            }
        }

        Optional<BollingerBands> bands = snapshot.bollinger();
        if (bands.isPresent()) {
            if (snapshot.close().compareTo(bands.get().lower()) <= 0) {
                buy.add(TechnicalCondition.BOLLINGER);
                buyReasons.add("close at lower band");
            } else if (snapshot.close().compareTo(bands.get().upper()) >= 0) {
                sell.add(TechnicalCondition.BOLLINGER);
                sellReasons.add("close at upper band");
            }
        }

        Optional<BigDecimal> volumeRatio = snapshot.volumeRatio();
        Optional<IndicatorSnapshot> previous = context.previous();
        if (volumeRatio.isPresent() && previous.isPresent()
                && volumeRatio.get().compareTo(settings.volumeSurgeRatio()) >= 0) {
            int move = snapshot.close().compareTo(previous.get().close());
            if (move > 0) {
                buy.add(TechnicalCondition.VOLUME);
                buyReasons.add("volume surge on up bar");
            } else if (move < 0) {
                sell.add(TechnicalCondition.VOLUME);
                sellReasons.add("volume surge on down bar");
            }
        }

        boolean buyFires = buy.containsAll(settings.buyRequires());
        boolean sellFires = (!settings.sellRequires().isEmpty() && sell.containsAll(settings.sellRequires()))
            || (settings.sellOnOverbought() && overbought);

        if (buyFires && sellFires) {
            logger.debug("{}: conflicting buy {} and sell {} conditions", snapshot.timestamp(), buy, sell);
            return Signal.hold(snapshot.timestamp(), NAME, "conflicting conditions");
        }
        if (buyFires) {
            return new Signal(snapshot.timestamp(), Direction.BUY, strength(buy), NAME, String.join(", ", buyReasons));
        }
        if (sellFires) {
            return new Signal(snapshot.timestamp(), Direction.SELL, strength(sell), NAME, String.join(", ", sellReasons));
        }
        return Signal.hold(snapshot.timestamp(), NAME, "no rule fired");
    }

    private static double strength(Set<TechnicalCondition> conditions) {
        double total = 0.0;
        for (TechnicalCondition condition : conditions) {
            total += condition.weight();
        }
        return Math.min(1.0, Math.round(total * 100.0) / 100.0);
    }
}
