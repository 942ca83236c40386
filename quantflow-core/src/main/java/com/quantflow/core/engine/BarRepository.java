package com.quantflow.core.engine;

import com.quantflow.core.model.Bar;

import java.time.Instant;
import java.util.List;

/**
 * Read access to stored historical bars.
 */
public interface BarRepository {

    /**
     * Bars for {@code instrument} with {@code from <= timestamp < to}, oldest first.
     */
    List<Bar> findBars(String instrument, Instant from, Instant to);
}
