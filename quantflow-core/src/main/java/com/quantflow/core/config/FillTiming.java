package com.quantflow.core.config;

/**
 * When a simulated order fills relative to the bar that produced it.
 */
public enum FillTiming {
    /** Open of the bar after the decision bar. */
    NEXT_BAR_OPEN,
    /** Close of the decision bar itself. */
    SAME_BAR_CLOSE
}
