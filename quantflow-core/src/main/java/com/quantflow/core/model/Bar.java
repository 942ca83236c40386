package com.quantflow.core.model;

import com.quantflow.core.error.MarketDataException;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OHLCV record for a fixed interval. Immutable once recorded.
 */
public record Bar(
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {
    public Bar {
        if (timestamp == null) {
            throw new MarketDataException("Bar timestamp is missing");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new MarketDataException("Bar at " + timestamp + " has a missing price");
        }
        if (open.signum() <= 0 || high.signum() <= 0 || low.signum() <= 0 || close.signum() <= 0) {
            throw new MarketDataException("Bar at " + timestamp + " has a non-positive price");
        }
        if (high.compareTo(low) < 0) {
            throw new MarketDataException("Bar at " + timestamp + " has high " + high + " below low " + low);
        }
        if (open.compareTo(low) < 0 || open.compareTo(high) > 0
                || close.compareTo(low) < 0 || close.compareTo(high) > 0) {
            throw new MarketDataException("Bar at " + timestamp + " has open/close outside its range");
        }
        if (volume < 0) {
            throw new MarketDataException("Bar at " + timestamp + " has negative volume " + volume);
        }
    }

    public static Bar of(Instant timestamp, String open, String high, String low, String close, long volume) {
        return new Bar(timestamp, new BigDecimal(open), new BigDecimal(high),
            new BigDecimal(low), new BigDecimal(close), volume);
    }
}
