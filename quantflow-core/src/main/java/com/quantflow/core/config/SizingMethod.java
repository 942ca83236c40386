package com.quantflow.core.config;

public enum SizingMethod {
    FIXED_AMOUNT,
    FIXED_FRACTION,
    KELLY,
    ATR
}
