package com.tapas.pando.analytics.repository;

/**
 * Thrown when a warehouse session cannot be opened at all.
 */
public class WarehouseConnectionException extends RuntimeException {

    public WarehouseConnectionException(Throwable cause) {
        super("Database connection failed", cause);
    }
}
