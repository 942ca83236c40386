package com.quantflow.core.config;

import com.quantflow.core.strategy.TechnicalCondition;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Strategy selection and thresholds.
 *
 * @param buyRequires      conditions that must all hold for a technical buy
 * @param sellRequires     conditions that must all hold for a technical sell
 * @param sellOnOverbought also sell whenever RSI is above the overbought level
 */
public record StrategySettings(
    StrategyType type,
    BigDecimal rsiOverbought,
    BigDecimal rsiOversold,
    Set<TechnicalCondition> buyRequires,
    Set<TechnicalCondition> sellRequires,
    boolean sellOnOverbought,
    BigDecimal volumeSurgeRatio,
    BigDecimal momentumThreshold,
    BigDecimal strongMomentumThreshold,
    BigDecimal volumeChangeThreshold
) {
    public StrategySettings {
        buyRequires = Set.copyOf(buyRequires);
        sellRequires = Set.copyOf(sellRequires);
    }
}
