package com.quantflow.core.model;

public enum OrderType {
    MARKET,
    LIMIT
}
