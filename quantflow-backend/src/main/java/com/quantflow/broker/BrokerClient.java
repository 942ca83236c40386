package com.quantflow.broker;

import com.quantflow.core.model.Bar;

import java.time.Instant;
import java.util.List;

/**
 * Brokerage operations the pipeline needs: historical and recent bars, order placement and status,
 * and the current holding. Failures surface as {@link BrokerException}.
 */
public interface BrokerClient {

    /**
     * Bars with {@code start <= timestamp < end}, oldest first.
     */
    List<Bar> getBars(String instrument, Instant start, Instant end);

    BrokerOrder submitOrder(OrderRequest request);

    BrokerOrder getOrder(String orderId);

    void cancelOrder(String orderId);

    /**
     * Shares currently held, zero when there is no position.
     */
    long getPositionQuantity(String instrument);
}
