package com.quantflow.core.indicator;

import com.quantflow.core.config.IndicatorSettings;
import com.quantflow.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Incremental indicator calculator.
 *
 * <p>Keeps the trailing {@code window} bars and recomputes every indicator from that window when a
 * bar is appended, so the snapshot for a bar depends only on the bar and the ones before it inside
 * the window. Live and replay paths that feed the same bars get identical snapshots.
 */
public final class IndicatorEngine {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorEngine.class);

    private final IndicatorSettings settings;
    private final Deque<Bar> window;
    private long barsSeen;

    public IndicatorEngine(IndicatorSettings settings) {
        this.settings = settings;
        this.window = new ArrayDeque<>(settings.window());
    }

    /**
     * Compute snapshots for a whole sequence with a fresh engine.
     * Bars before the shortest lookback produce no entry.
     */
    public static List<IndicatorSnapshot> computeAll(IndicatorSettings settings, List<Bar> bars) {
        IndicatorEngine engine = new IndicatorEngine(settings);
        List<IndicatorSnapshot> out = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            engine.append(bar).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Add the next bar and compute its snapshot.
     *
     * @return empty while no configured indicator has enough history
     */
    public Optional<IndicatorSnapshot> append(Bar bar) {
        if (window.size() == settings.window()) {
            window.removeFirst();
        }
        window.addLast(bar);
        long index = barsSeen++;

        List<Bar> bars = new ArrayList<>(window);
        List<BigDecimal> closes = new ArrayList<>(bars.size());
        List<BigDecimal> volumes = new ArrayList<>(bars.size());
        for (Bar b : bars) {
            closes.add(b.close());
            volumes.add(BigDecimal.valueOf(b.volume()));
        }
        int n = bars.size();

        Map<IndicatorName, BigDecimal> scalars = new EnumMap<>(IndicatorName.class);
        if (n >= settings.shortMa()) {
            scalars.put(IndicatorName.MA_SHORT, Indicators.sma(closes, settings.shortMa()));
        }
        if (n >= settings.longMa()) {
            scalars.put(IndicatorName.MA_LONG, Indicators.sma(closes, settings.longMa()));
        }
        if (n >= settings.rsiLookback()) {
            scalars.put(IndicatorName.RSI, Indicators.rsi(closes, settings.rsiPeriod()));
        }
        if (n >= settings.volumeMa()) {
            scalars.put(IndicatorName.VOLUME_MA, Indicators.sma(volumes, settings.volumeMa()));
        }
        if (n >= settings.atrLookback()) {
            scalars.put(IndicatorName.ATR, Indicators.atr(bars, settings.atrPeriod()));
        }
        if (n >= settings.momentumLookback()) {
            scalars.put(IndicatorName.MOMENTUM, Indicators.rateOfChange(closes, settings.momentumPeriod()));
        }
        MacdValue macd = n >= settings.macdLookback()
            ? Indicators.macd(closes, settings.macdFast(), settings.macdSlow(), settings.macdSignal())
            : null;
        BollingerBands bands = n >= settings.bollingerPeriod()
            ? Indicators.bollinger(closes, settings.bollingerPeriod(), settings.bollingerK())
            : null;

        if (scalars.isEmpty() && macd == null && bands == null) {
            return Optional.empty();
        }
        IndicatorSnapshot snapshot = new IndicatorSnapshot(index, bar, scalars, macd, bands);
        if (logger.isDebugEnabled()) {
            logger.debug("Bar {} {}: {}", index, bar.timestamp(), snapshot.values());
        }
        return Optional.of(snapshot);
    }

    public long barsSeen() {
        return barsSeen;
    }

    public int maxLookback() {
        return settings.maxLookback();
    }
}
