package com.quantflow.core.execution;

import com.quantflow.core.error.OrderExecutionException;
import com.quantflow.core.model.Bar;
import com.quantflow.core.model.Fill;
import com.quantflow.core.model.OrderIntent;

/**
 * Turns an approved intent into a fill. The replay driver calls this the same way whether the
 * implementation simulates against historical bars or talks to a broker.
 */
public interface ExecutionAdapter {

    /**
     * Execute {@code intent}.
     *
     * @param bar the bar being processed when the order is sent; simulated fills price off it
     * @throws OrderExecutionException if nothing was filled; the caller's state must stay unchanged
     */
    Fill execute(OrderIntent intent, Bar bar) throws OrderExecutionException;

    /** Short name for logs and audit records, e.g. "simulated" or "alpaca". */
    String mode();
}
