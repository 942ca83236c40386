package com.quantflow.core.model;

public enum Direction {
    BUY,
    SELL,
    HOLD;

    public String side() {
        return name().toLowerCase();
    }
}
