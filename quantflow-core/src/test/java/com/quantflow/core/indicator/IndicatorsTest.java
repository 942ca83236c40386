package com.quantflow.core.indicator;

import com.quantflow.core.TestBars;
import com.quantflow.core.model.Bar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Indicator Math Tests")
class IndicatorsTest {

    private static List<BigDecimal> values(String... raw) {
        List<BigDecimal> out = new ArrayList<>();
        for (String v : raw) {
            out.add(new BigDecimal(v));
        }
        return out;
    }

    @Test
    @DisplayName("SMA averages the trailing period only")
    void testSma() {
        assertThat(Indicators.sma(values("1", "2", "3", "4", "5"), 3)).isEqualByComparingTo("4");
        assertThat(Indicators.sma(values("1", "2", "3", "4", "5"), 5)).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("EMA is seeded with the SMA of the first period")
    void testEmaSeed() {
        List<BigDecimal> ema = Indicators.emaSeries(values("2", "4", "6", "8"), 3);
        assertThat(ema).hasSize(2);
        assertThat(ema.get(0)).isEqualByComparingTo("4");
        // alpha = 0.5: 8 * 0.5 + 4 * 0.5
        assertThat(ema.get(1)).isEqualByComparingTo("6");
    }

    @Test
    @DisplayName("RSI reads 50 when flat and 100 with no losses")
    void testRsiEdges() {
        assertThat(Indicators.rsi(values("10", "10", "10", "10"), 3)).isEqualByComparingTo("50");
        assertThat(Indicators.rsi(values("10", "11", "12", "13"), 3)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("RSI with equal average gain and loss is 50")
    void testRsiBalanced() {
        assertThat(Indicators.rsi(values("10", "11", "10", "11", "10"), 4).doubleValue()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    @DisplayName("Bollinger bands collapse on a constant series")
    void testBollingerConstant() {
        BollingerBands bands = Indicators.bollinger(values("5", "5", "5", "5"), 4, new BigDecimal("2"));
        assertThat(bands.upper()).isEqualByComparingTo("5");
        assertThat(bands.lower()).isEqualByComparingTo("5");
        assertThat(bands.bandwidth()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Bollinger width uses the sample standard deviation")
    void testBollingerWidth() {
        // mean 2, sample variance 1
        BollingerBands bands = Indicators.bollinger(values("1", "2", "3"), 3, new BigDecimal("2"));
        assertThat(bands.middle()).isEqualByComparingTo("2");
        assertThat(bands.upper()).isEqualByComparingTo("4");
        assertThat(bands.lower()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("ATR seeds with the mean true range including gaps")
    void testAtr() {
        List<Bar> bars = List.of(
            Bar.of(TestBars.day(0), "10", "10.5", "9.5", "10", 100),
            Bar.of(TestBars.day(1), "10", "11", "10", "11", 100),
            Bar.of(TestBars.day(2), "12", "12.5", "12", "12", 100));
        // true ranges: 1.0 and max(0.5, 1.5, 1.0) = 1.5
        assertThat(Indicators.atr(bars, 2)).isEqualByComparingTo("1.25");
    }

    @Test
    @DisplayName("ATR smooths later true ranges the Wilder way")
    void testAtrWilderSmoothing() {
        List<Bar> bars = List.of(
            Bar.of(TestBars.day(0), "10", "10.5", "9.5", "10", 100),
            Bar.of(TestBars.day(1), "10", "11", "10", "11", 100),
            Bar.of(TestBars.day(2), "12", "12.5", "12", "12", 100),
            Bar.of(TestBars.day(3), "12", "13", "12", "13", 100));
        // seed 1.25 from the first two ranges, then (1.25 * 1 + 1.0) / 2
        assertThat(Indicators.atr(bars, 2)).isEqualByComparingTo("1.125");
    }

    @Test
    @DisplayName("Rate of change compares against the close n bars back")
    void testRateOfChange() {
        assertThat(Indicators.rateOfChange(values("10", "12", "11"), 2)).isEqualByComparingTo("0.1");
    }

    @Test
    @DisplayName("MACD of a constant series is zero")
    void testMacdConstant() {
        List<BigDecimal> closes = new ArrayList<>();
        for (int i = 0; i < 34; i++) {
            closes.add(BigDecimal.TEN);
        }
        MacdValue macd = Indicators.macd(closes, 12, 26, 9);
        assertThat(macd.line()).isEqualByComparingTo("0");
        assertThat(macd.histogram()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Too little history is rejected")
    void testInsufficientHistory() {
        assertThatThrownBy(() -> Indicators.macd(values("1", "2", "3"), 12, 26, 9))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("MACD");
    }
}
