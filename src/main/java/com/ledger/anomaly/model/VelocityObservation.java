package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VelocityObservation {

    String glAccount;

    // fiscalYear-fiscalPeriod
    String period;

    long transactionCount;
    double totalAmount;
    double averageTransactionCount;
    double averageAmount;

    // % change from the trailing average
    double countDeviation;
    double amountDeviation;

    Severity severity;

    public double getMaxDeviation() {
        return Math.max(Math.abs(countDeviation), Math.abs(amountDeviation));
    }
}
