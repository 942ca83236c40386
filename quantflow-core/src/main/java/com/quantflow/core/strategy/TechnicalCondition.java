package com.quantflow.core.strategy;

/**
 * Sub-signals of the technical rule strategy and their weight in the combined strength.
 */
public enum TechnicalCondition {
    MA_CROSS(0.30),
    RSI(0.20),
    MACD_CROSS(0.25),
    BOLLINGER(0.15),
    VOLUME(0.10);

    private final double weight;

    TechnicalCondition(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
