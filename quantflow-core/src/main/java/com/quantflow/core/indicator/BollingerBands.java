package com.quantflow.core.indicator;

import java.math.BigDecimal;
import java.math.MathContext;

public record BollingerBands(BigDecimal upper, BigDecimal middle, BigDecimal lower) {

    /** Band width relative to the middle band. */
    public BigDecimal bandwidth() {
        return upper.subtract(lower).divide(middle, MathContext.DECIMAL64);
    }
}
