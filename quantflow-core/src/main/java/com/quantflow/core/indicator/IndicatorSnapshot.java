package com.quantflow.core.indicator;

import com.quantflow.core.model.Bar;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Indicator values for one bar. Indicators whose lookback is not yet satisfied are absent, not zero.
 */
public final class IndicatorSnapshot {

    private final long index;
    private final Bar bar;
    private final Map<IndicatorName, BigDecimal> scalars;
    private final MacdValue macd;
    private final BollingerBands bollinger;

    IndicatorSnapshot(long index, Bar bar, Map<IndicatorName, BigDecimal> scalars,
                      MacdValue macd, BollingerBands bollinger) {
        this.index = index;
        this.bar = Objects.requireNonNull(bar, "bar");
        EnumMap<IndicatorName, BigDecimal> copy = new EnumMap<>(IndicatorName.class);
        copy.putAll(scalars);
        this.scalars = Collections.unmodifiableMap(copy);
        this.macd = macd;
        this.bollinger = bollinger;
    }

    /** Zero-based position of the bar in the sequence fed to the engine. */
    public long index() {
        return index;
    }

    public Bar bar() {
        return bar;
    }

    public Instant timestamp() {
        return bar.timestamp();
    }

    public BigDecimal close() {
        return bar.close();
    }

    public Optional<BigDecimal> shortMa() {
        return scalar(IndicatorName.MA_SHORT);
    }

    public Optional<BigDecimal> longMa() {
        return scalar(IndicatorName.MA_LONG);
    }

    public Optional<BigDecimal> rsi() {
        return scalar(IndicatorName.RSI);
    }

    public Optional<BigDecimal> volumeMa() {
        return scalar(IndicatorName.VOLUME_MA);
    }

    public Optional<BigDecimal> atr() {
        return scalar(IndicatorName.ATR);
    }

    public Optional<BigDecimal> momentum() {
        return scalar(IndicatorName.MOMENTUM);
    }

    public Optional<MacdValue> macd() {
        return Optional.ofNullable(macd);
    }

    public Optional<BollingerBands> bollinger() {
        return Optional.ofNullable(bollinger);
    }

    public Optional<BigDecimal> scalar(IndicatorName name) {
        return Optional.ofNullable(scalars.get(name));
    }

    public boolean has(IndicatorName name) {
        if (name == IndicatorName.MACD) {
            return macd != null;
        }
        if (name == IndicatorName.BOLLINGER) {
            return bollinger != null;
        }
        return scalars.containsKey(name);
    }

    /**
     * Volume of this bar relative to its moving average, when the average is defined and non-zero.
     */
    public Optional<BigDecimal> volumeRatio() {
        return volumeMa()
            .filter(avg -> avg.signum() > 0)
            .map(avg -> BigDecimal.valueOf(bar.volume()).divide(avg, Indicators.MC));
    }

    /** Flat name to value view, in indicator declaration order. */
    public Map<String, Object> values() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (IndicatorName name : IndicatorName.values()) {
            if (name == IndicatorName.MACD && macd != null) {
                out.put("macd_line", macd.line());
                out.put("macd_signal", macd.signal());
                out.put("macd_histogram", macd.histogram());
            } else if (name == IndicatorName.BOLLINGER && bollinger != null) {
                out.put("bb_upper", bollinger.upper());
                out.put("bb_middle", bollinger.middle());
                out.put("bb_lower", bollinger.lower());
            } else if (scalars.containsKey(name)) {
                out.put(name.key(), scalars.get(name));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndicatorSnapshot)) return false;
        IndicatorSnapshot that = (IndicatorSnapshot) o;
        return index == that.index
            && bar.equals(that.bar)
            && scalars.equals(that.scalars)
            && Objects.equals(macd, that.macd)
            && Objects.equals(bollinger, that.bollinger);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, bar, scalars, macd, bollinger);
    }

    @Override
    public String toString() {
        return "IndicatorSnapshot{index=" + index + ", ts=" + bar.timestamp() + ", " + values() + "}";
    }
}
