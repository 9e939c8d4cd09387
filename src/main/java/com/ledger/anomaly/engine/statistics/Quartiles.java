package com.ledger.anomaly.engine.statistics;

import lombok.Value;

@Value
public class Quartiles {

    double q1;
    double q2;
    double q3;

    public double getIqr() {
        return q3 - q1;
    }
}
