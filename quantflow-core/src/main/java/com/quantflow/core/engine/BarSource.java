package com.quantflow.core.engine;

import com.quantflow.core.model.Bar;

import java.util.Optional;

/**
 * Supplies bars in timestamp order. Historical sources return immediately; live sources block
 * until the next bar is available.
 */
public interface BarSource extends AutoCloseable {

    /**
     * @return the next bar, or empty at end of stream
     */
    Optional<Bar> next();

    @Override
    default void close() {
    }
}
