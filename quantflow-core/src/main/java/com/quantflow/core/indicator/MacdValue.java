package com.quantflow.core.indicator;

import java.math.BigDecimal;

public record MacdValue(BigDecimal line, BigDecimal signal, BigDecimal histogram) {
}
