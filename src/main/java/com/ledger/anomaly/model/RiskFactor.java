package com.ledger.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactor {

    private AnomalyType factor;
    private Severity severity;
    private String description;

    // 1-10
    private int impact;
}
