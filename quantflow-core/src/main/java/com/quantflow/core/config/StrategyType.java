package com.quantflow.core.config;

public enum StrategyType {
    TECHNICAL,
    MOMENTUM
}
