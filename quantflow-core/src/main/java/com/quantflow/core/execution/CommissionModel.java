package com.quantflow.core.execution;

import com.quantflow.core.config.ExecutionSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rate times notional, rounded to cents, never below the configured minimum.
 */
public final class CommissionModel {

    private final BigDecimal rate;
    private final BigDecimal minimum;

    public CommissionModel(ExecutionSettings settings) {
        this(settings.commissionRate(), settings.minCommission());
    }

    public CommissionModel(BigDecimal rate, BigDecimal minimum) {
        this.rate = rate;
        this.minimum = minimum;
    }

    public BigDecimal commissionFor(BigDecimal notional) {
        if (rate.signum() == 0 && minimum.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return notional.multiply(rate).setScale(2, RoundingMode.HALF_UP).max(minimum);
    }
}
