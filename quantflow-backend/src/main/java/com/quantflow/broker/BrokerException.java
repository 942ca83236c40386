package com.quantflow.broker;

/**
 * Broker call failed. Rate limiting, server errors and I/O failures are retryable; client errors
 * such as a rejected order are not.
 */
public class BrokerException extends RuntimeException {

    private final int statusCode;
    private final boolean retryable;

    public BrokerException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = statusCode == 429 || statusCode >= 500;
    }

    public BrokerException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.statusCode = -1;
        this.retryable = retryable;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
