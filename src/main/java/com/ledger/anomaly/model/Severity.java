package com.ledger.anomaly.model;

/**
 * Anomaly severity. Declaration order is significant: later constants are more severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
