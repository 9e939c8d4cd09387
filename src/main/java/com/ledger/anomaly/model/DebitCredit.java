package com.ledger.anomaly.model;

public enum DebitCredit {
    DEBIT,
    CREDIT
}
