package com.quantflow.core.risk;

/**
 * Why the risk controller blocked a signal. Listed in the order the checks run.
 */
public enum VetoReason {
    FREQUENCY_CAP("frequency-cap"),
    DRAWDOWN_BREAKER("drawdown-breaker"),
    DAILY_LOSS_BREAKER("daily-loss-breaker"),
    SIZE_OUT_OF_RANGE("size-out-of-range"),
    POSITION_CAP("position-cap");

    private final String tag;

    VetoReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
