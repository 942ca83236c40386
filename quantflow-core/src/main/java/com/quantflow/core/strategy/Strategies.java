package com.quantflow.core.strategy;

import com.quantflow.core.config.StrategySettings;

public final class Strategies {

    private Strategies() {
    }

    public static TradingStrategy create(StrategySettings settings) {
        return switch (settings.type()) {
            case TECHNICAL -> new TechnicalRuleStrategy(settings);
            case MOMENTUM -> new MomentumStrategy(settings);
        };
    }
}
