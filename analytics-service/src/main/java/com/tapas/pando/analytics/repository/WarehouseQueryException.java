package com.tapas.pando.analytics.repository;

/**
 * Thrown when a statement fails after the session was opened. The message is the
 * driver's own text and is passed through to the caller unchanged.
 */
public class WarehouseQueryException extends RuntimeException {

    public WarehouseQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
