package com.ledger.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionSummary {

    private long criticalAnomalies;
    private long highAnomalies;
    private long mediumAnomalies;
    private long lowAnomalies;
    private Map<AnomalyType, Long> byType;

    // 0-100
    private double estimatedFraudRisk;

    public long getTotal() {
        return criticalAnomalies + highAnomalies + mediumAnomalies + lowAnomalies;
    }
}
