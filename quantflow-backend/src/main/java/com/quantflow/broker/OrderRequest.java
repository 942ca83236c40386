package com.quantflow.broker;

import com.quantflow.core.model.OrderIntent;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A day order for whole shares. {@code limitPrice} is null for market orders.
 */
public record OrderRequest(
    String instrument,
    String side,
    long quantity,
    String type,
    BigDecimal limitPrice,
    String clientOrderId
) {
    public OrderRequest {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(type, "type");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        if ("limit".equals(type) && limitPrice == null) {
            throw new IllegalArgumentException("Limit order requires a limit price");
        }
    }

    public static OrderRequest from(OrderIntent intent, String clientOrderId) {
        var reference = intent.priceReference();
        return new OrderRequest(intent.instrument(), intent.direction().side(), intent.quantity(),
            reference.isLimit() ? "limit" : "market", reference.limitPrice(), clientOrderId);
    }
}
