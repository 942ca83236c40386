package com.quantflow.persistence;

/**
 * A read or write against the SQLite store failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
