package com.quantflow.core.risk;

import java.math.BigDecimal;

/**
 * Quantity chosen by the position sizer, or a rejection (quantity 0) with the reason.
 */
public record SizingResult(long quantity, BigDecimal notional, String detail) {

    public static SizingResult rejected(String detail) {
        return new SizingResult(0, BigDecimal.ZERO, detail);
    }

    public boolean accepted() {
        return quantity > 0;
    }
}
