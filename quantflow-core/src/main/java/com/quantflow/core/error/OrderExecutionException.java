package com.quantflow.core.error;

/**
 * An order could not be executed: broker failure, timeout, rejection,
 * or a simulated fill the account cannot afford.
 * Portfolio state is left untouched when this is thrown.
 */
public class OrderExecutionException extends Exception {

    private final boolean timeout;

    public OrderExecutionException(String message) {
        this(message, null, false);
    }

    public OrderExecutionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public OrderExecutionException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static OrderExecutionException timedOut(String message, Throwable cause) {
        return new OrderExecutionException(message, cause, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
