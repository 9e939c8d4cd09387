package com.ledger.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountRiskProfile {

    private String glAccount;
    private String glAccountName;

    // 0-100
    private double riskScore;
    private RiskLevel riskLevel;

    private List<RiskFactor> riskFactors;
    private long anomalyCount;
    private long criticalAnomalyCount;

    // p-value x 100 of the account's Benford test; null when the account was not tested
    private Double benfordComplianceScore;

    private List<String> controlWeaknesses;
    private List<String> recommendations;
    private Instant lastAssessedAt;
}
