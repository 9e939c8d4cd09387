package com.ledger.anomaly.datasource;

/**
 * Wraps a checked failure from a {@link GLDataSource}. Unchecked failures are rethrown as-is.
 */
public class GLDataSourceException extends RuntimeException {

    public GLDataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
