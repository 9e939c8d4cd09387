package com.ledger.anomaly.model;

public enum AnomalyType {
    BENFORD_LAW_VIOLATION,
    STATISTICAL_OUTLIER,
    UNUSUAL_AMOUNT,
    SAME_DAY_REVERSAL,
    WEEKEND_POSTING,
    AFTER_HOURS_POSTING,
    ROUND_NUMBER_PATTERN,
    VELOCITY_ANOMALY,
    DUPLICATE_ENTRY,
    // Reserved for review tooling; no detector in this engine emits them.
    UNUSUAL_USER,
    THRESHOLD_BREACH
}
