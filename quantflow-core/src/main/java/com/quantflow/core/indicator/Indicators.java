package com.quantflow.core.indicator;

import com.quantflow.core.model.Bar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure indicator math over an ordered window of values, oldest first.
 * Every function reads only the values it is given.
 */
public final class Indicators {
    public static final MathContext MC = MathContext.DECIMAL64;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal NEUTRAL_RSI = BigDecimal.valueOf(50);

    private Indicators() {
    }

    /**
     * Simple moving average of the last {@code period} values.
     */
    public static BigDecimal sma(List<BigDecimal> values, int period) {
        requireSize(values, period, "SMA");
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = values.size() - period; i < values.size(); i++) {
            sum = sum.add(values.get(i));
        }
        return sum.divide(BigDecimal.valueOf(period), MC);
    }

    /**
     * Exponential moving average series seeded with the SMA of the first {@code period} values.
     * Element 0 of the result corresponds to input index {@code period - 1}.
     */
    public static List<BigDecimal> emaSeries(List<BigDecimal> values, int period) {
        requireSize(values, period, "EMA");
        BigDecimal alpha = TWO.divide(BigDecimal.valueOf(period + 1L), MC);
        BigDecimal oneMinusAlpha = BigDecimal.ONE.subtract(alpha, MC);
        List<BigDecimal> out = new ArrayList<>(values.size() - period + 1);
        BigDecimal ema = sma(values.subList(0, period), period);
        out.add(ema);
        for (int i = period; i < values.size(); i++) {
            ema = values.get(i).multiply(alpha, MC).add(ema.multiply(oneMinusAlpha, MC), MC);
            out.add(ema);
        }
        return out;
    }

    /**
     * RSI with Wilder smoothing. Needs {@code period + 1} values.
     * A window with no movement reads 50; one with gains and no losses reads 100.
     */
    public static BigDecimal rsi(List<BigDecimal> closes, int period) {
        requireSize(closes, period + 1, "RSI");
        BigDecimal p = BigDecimal.valueOf(period);
        BigDecimal pMinusOne = BigDecimal.valueOf(period - 1L);
        BigDecimal avgGain = BigDecimal.ZERO;
        BigDecimal avgLoss = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            BigDecimal delta = closes.get(i).subtract(closes.get(i - 1));
            if (delta.signum() > 0) {
                avgGain = avgGain.add(delta);
            } else {
                avgLoss = avgLoss.subtract(delta);
            }
        }
        avgGain = avgGain.divide(p, MC);
        avgLoss = avgLoss.divide(p, MC);
        for (int i = period + 1; i < closes.size(); i++) {
            BigDecimal delta = closes.get(i).subtract(closes.get(i - 1));
            BigDecimal gain = delta.signum() > 0 ? delta : BigDecimal.ZERO;
            BigDecimal loss = delta.signum() < 0 ? delta.negate() : BigDecimal.ZERO;
            avgGain = avgGain.multiply(pMinusOne).add(gain).divide(p, MC);
            avgLoss = avgLoss.multiply(pMinusOne).add(loss).divide(p, MC);
        }
        if (avgLoss.signum() == 0) {
            return avgGain.signum() == 0 ? NEUTRAL_RSI : HUNDRED;
        }
        BigDecimal rs = avgGain.divide(avgLoss, MC);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), MC), MC);
    }

    /**
     * MACD line (fast EMA minus slow EMA), its EMA signal line and the histogram.
     * Needs {@code slow + signal - 1} values.
     */
    public static MacdValue macd(List<BigDecimal> closes, int fast, int slow, int signal) {
        requireSize(closes, slow + signal - 1, "MACD");
        List<BigDecimal> fastEma = emaSeries(closes, fast);
        List<BigDecimal> slowEma = emaSeries(closes, slow);
        int offset = slow - fast;
        List<BigDecimal> line = new ArrayList<>(slowEma.size());
        for (int i = 0; i < slowEma.size(); i++) {
            line.add(fastEma.get(i + offset).subtract(slowEma.get(i), MC));
        }
        List<BigDecimal> signalLine = emaSeries(line, signal);
        BigDecimal lastLine = line.get(line.size() - 1);
        BigDecimal lastSignal = signalLine.get(signalLine.size() - 1);
        return new MacdValue(lastLine, lastSignal, lastLine.subtract(lastSignal, MC));
    }

    /**
     * Bollinger bands: mean of the last {@code period} closes plus/minus k sample standard deviations.
     */
    public static BollingerBands bollinger(List<BigDecimal> closes, int period, BigDecimal k) {
        requireSize(closes, period, "Bollinger");
        BigDecimal mean = sma(closes, period);
        BigDecimal squares = BigDecimal.ZERO;
        for (int i = closes.size() - period; i < closes.size(); i++) {
            BigDecimal diff = closes.get(i).subtract(mean, MC);
            squares = squares.add(diff.multiply(diff, MC), MC);
        }
        BigDecimal variance = squares.divide(BigDecimal.valueOf(period - 1L), MC);
        BigDecimal width = variance.sqrt(MC).multiply(k, MC);
        return new BollingerBands(mean.add(width, MC), mean, mean.subtract(width, MC));
    }

    /**
     * Average true range with Wilder smoothing, seeded with the mean of the first {@code period}
     * true ranges in the window. Needs {@code period + 1} bars.
     */
    public static BigDecimal atr(List<Bar> bars, int period) {
        requireSize(bars, period + 1, "ATR");
        BigDecimal p = BigDecimal.valueOf(period);
        BigDecimal pMinusOne = BigDecimal.valueOf(period - 1L);
        BigDecimal atr = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            atr = atr.add(trueRange(bars.get(i), bars.get(i - 1).close()));
        }
        atr = atr.divide(p, MC);
        for (int i = period + 1; i < bars.size(); i++) {
            atr = atr.multiply(pMinusOne).add(trueRange(bars.get(i), bars.get(i - 1).close())).divide(p, MC);
        }
        return atr;
    }

    private static BigDecimal trueRange(Bar bar, BigDecimal prevClose) {
        return bar.high().subtract(bar.low())
            .max(bar.high().subtract(prevClose).abs())
            .max(bar.low().subtract(prevClose).abs());
    }

    /**
     * Fractional price change over {@code period} bars: (c[t] - c[t-n]) / c[t-n].
     */
    public static BigDecimal rateOfChange(List<BigDecimal> closes, int period) {
        requireSize(closes, period + 1, "Rate of change");
        BigDecimal latest = closes.get(closes.size() - 1);
        BigDecimal base = closes.get(closes.size() - 1 - period);
        return latest.subtract(base).divide(base, MC);
    }

    private static void requireSize(List<?> values, int required, String indicator) {
        if (values.size() < required) {
            throw new IllegalArgumentException(indicator + " needs " + required
                + " values, got " + values.size());
        }
    }
}
