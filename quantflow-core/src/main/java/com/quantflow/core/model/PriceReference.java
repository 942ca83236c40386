package com.quantflow.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Market order, or limit order with its limit price.
 */
public record PriceReference(OrderType type, BigDecimal limitPrice) {

    public PriceReference {
        Objects.requireNonNull(type, "type");
        if (type == OrderType.LIMIT && (limitPrice == null || limitPrice.signum() <= 0)) {
            throw new IllegalArgumentException("Limit order requires a positive limit price");
        }
        if (type == OrderType.MARKET) {
            limitPrice = null;
        }
    }

    public static PriceReference market() {
        return new PriceReference(OrderType.MARKET, null);
    }

    public static PriceReference limit(BigDecimal price) {
        return new PriceReference(OrderType.LIMIT, price);
    }

    public boolean isLimit() {
        return type == OrderType.LIMIT;
    }
}
