package com.quantflow.core.error;

/**
 * Malformed, missing or out-of-sequence market data.
 * A run that sees one of these halts rather than skipping the bar.
 */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
