package com.quantflow.core.config;

import java.math.BigDecimal;

/**
 * Indicator periods. {@code window} is how many trailing bars each snapshot is computed from.
 */
public record IndicatorSettings(
    int shortMa,
    int longMa,
    int rsiPeriod,
    int macdFast,
    int macdSlow,
    int macdSignal,
    int bollingerPeriod,
    BigDecimal bollingerK,
    int volumeMa,
    int atrPeriod,
    int momentumPeriod,
    int window
) {
    public int smaLookback() {
        return Math.max(shortMa, longMa);
    }

    public int rsiLookback() {
        return rsiPeriod + 1;
    }

    public int macdLookback() {
        return macdSlow + macdSignal - 1;
    }

    public int atrLookback() {
        return atrPeriod + 1;
    }

    public int momentumLookback() {
        return momentumPeriod + 1;
    }

    /** Largest number of bars any configured indicator needs before it is defined. */
    public int maxLookback() {
        return Math.max(Math.max(Math.max(smaLookback(), rsiLookback()), Math.max(macdLookback(), bollingerPeriod)),
            Math.max(Math.max(volumeMa, atrLookback()), momentumLookback()));
    }
}
