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
public class DetectionResult {

    private String analysisId;

    // Opaque pass-through
    private String tenantId;

    // First filtered account, when the run was scoped to accounts
    private String glAccount;

    private String fiscalYear;
    private String fiscalPeriod;
    private long totalLineItems;
    private long anomaliesDetected;

    // Severity descending; detector emission order within a severity
    private List<Anomaly> anomalies;

    private List<AccountStats> accountStats;
    private List<BenfordResult> benfordAnalysis;
    private List<VelocityObservation> velocityObservations;
    private List<DetectionDiagnostic> diagnostics;
    private DetectionSummary summary;
    private Instant completedAt;
}
