package com.ledger.anomaly.exception;

/**
 * Raised before any data is fetched when a detection request or its configuration is unusable.
 */
public class DetectionConfigurationException extends RuntimeException {

    public DetectionConfigurationException(String message) {
        super(message);
    }

    public DetectionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
