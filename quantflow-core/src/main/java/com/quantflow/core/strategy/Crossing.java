package com.quantflow.core.strategy;

public enum Crossing {
    /** Fast series moved from below to above the slow one on this bar. */
    UP,
    /** Fast series moved from above to below the slow one on this bar. */
    DOWN,
    NONE
}
