package com.ledger.anomaly.model;

/**
 * Review state of an anomaly. The engine always emits OPEN; transitions belong to the
 * downstream review workflow.
 */
public enum ReviewStatus {
    OPEN,
    INVESTIGATING,
    CONFIRMED,
    FALSE_POSITIVE,
    RESOLVED
}
