package com.quantflow.broker;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Broker-side view of an order. {@code filledAveragePrice} is null until something has filled.
 */
public record BrokerOrder(String id, String status, long filledQuantity, BigDecimal filledAveragePrice) {

    private static final Set<String> TERMINAL = Set.of("filled", "canceled", "expired", "rejected", "done_for_day");

    public boolean isFilled() {
        return "filled".equals(status);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(status);
    }

    public boolean hasFills() {
        return filledQuantity > 0 && filledAveragePrice != null;
    }
}
