package com.ledger.anomaly.service;

import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.DetectionSummary;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Severity and type counts for a run, plus the estimated fraud risk.
 *
 * Fraud risk: 15 per CRITICAL and 8 per HIGH anomaly, plus 20 when anomalies exceed
 * 10% of the line items (10 when above 5%), capped at 100.
 */
@Service
public class DetectionSummaryService {

    public DetectionSummary summarize(List<Anomaly> anomalies, long totalLineItems) {
        long critical = 0;
        long high = 0;
        long medium = 0;
        long low = 0;
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);

        for (Anomaly anomaly : anomalies) {
            switch (anomaly.getSeverity()) {
                case CRITICAL:
                    critical++;
                    break;
                case HIGH:
                    high++;
                    break;
                case MEDIUM:
                    medium++;
                    break;
                default:
                    low++;
                    break;
            }
            byType.merge(anomaly.getAnomalyType(), 1L, Long::sum);
        }

        return DetectionSummary.builder()
                .criticalAnomalies(critical)
                .highAnomalies(high)
                .mediumAnomalies(medium)
                .lowAnomalies(low)
                .byType(byType)
                .estimatedFraudRisk(estimateFraudRisk(critical, high, anomalies.size(), totalLineItems))
                .build();
    }

    static double estimateFraudRisk(long critical, long high, long anomalyCount, long totalLineItems) {
        double risk = critical * 15.0 + high * 8.0;

        if (totalLineItems > 0) {
            double anomalyRate = anomalyCount * 100.0 / totalLineItems;
            if (anomalyRate > 10) {
                risk += 20;
            } else if (anomalyRate > 5) {
                risk += 10;
            }
        }
        return Math.min(100.0, risk);
    }
}
