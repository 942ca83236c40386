package com.quantflow.core.config;

import com.quantflow.core.model.OrderType;

import java.math.BigDecimal;

public record ExecutionSettings(
    FillTiming fillTiming,
    OrderType orderType,
    BigDecimal commissionRate,
    BigDecimal minCommission,
    BigDecimal slippage,
    int lotSize
) {
}
