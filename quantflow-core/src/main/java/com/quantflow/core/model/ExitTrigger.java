package com.quantflow.core.model;

/**
 * Protective exits that force a full sell regardless of the strategy.
 */
public enum ExitTrigger {
    STOP_LOSS("stop-loss"),
    TRAILING_STOP("trailing-stop"),
    TAKE_PROFIT("take-profit");

    private final String tag;

    ExitTrigger(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
