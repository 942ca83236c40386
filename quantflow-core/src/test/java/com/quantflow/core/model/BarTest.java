package com.quantflow.core.model;

import com.quantflow.core.error.MarketDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Bar Tests")
class BarTest {

    private static final Instant TS = Instant.parse("2024-03-01T21:00:00Z");

    @Test
    @DisplayName("Should accept a well-formed bar")
    void testValidBar() {
        Bar bar = Bar.of(TS, "10.00", "10.50", "9.80", "10.20", 1_000);
        assertThat(bar.close()).isEqualByComparingTo("10.20");
        assertThat(bar.volume()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("Should reject high below low")
    void testHighBelowLow() {
        assertThatThrownBy(() -> Bar.of(TS, "10.00", "9.50", "9.80", "9.60", 1_000))
            .isInstanceOf(MarketDataException.class);
    }

    @Test
    @DisplayName("Should reject close outside the bar range")
    void testCloseOutsideRange() {
        assertThatThrownBy(() -> Bar.of(TS, "10.00", "10.50", "9.80", "10.80", 1_000))
            .isInstanceOf(MarketDataException.class);
    }

    @Test
    @DisplayName("Should reject non-positive prices and negative volume")
    void testNonPositiveValues() {
        assertThatThrownBy(() -> Bar.of(TS, "0", "10.50", "0", "10.00", 1_000))
            .isInstanceOf(MarketDataException.class);
        assertThatThrownBy(() -> Bar.of(TS, "10.00", "10.50", "9.80", "10.00", -1))
            .isInstanceOf(MarketDataException.class);
    }

    @Test
    @DisplayName("Signal strength outside [0,1] is rejected")
    void testSignalStrengthBounds() {
        assertThatThrownBy(() -> new Signal(TS, Direction.BUY, 1.2, "technical", "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Signal(TS, Direction.BUY, 0.65, "technical", "x").grade()).isEqualTo(SignalGrade.STRONG);
        assertThat(new Signal(TS, Direction.SELL, 0.3, "technical", "x").grade()).isEqualTo(SignalGrade.NORMAL);
        assertThat(Signal.hold(TS, "technical", "").grade()).isEqualTo(SignalGrade.WEAK);
    }
}
