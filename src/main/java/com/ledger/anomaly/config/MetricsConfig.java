package com.ledger.anomaly.config;

import com.ledger.anomaly.model.Anomaly;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String outcome, long lineItems) {
        Counter.builder("gl.detection.runs")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("gl.detection.line_items")
                .register(registry)
                .record(lineItems);
    }

    public void recordAnomalies(List<Anomaly> anomalies) {
        for (Anomaly anomaly : anomalies) {
            Counter.builder("gl.anomalies.detected")
                    .tag("type", anomaly.getAnomalyType().name())
                    .tag("severity", anomaly.getSeverity().name())
                    .register(registry)
                    .increment();
        }
    }

    public void recordFraudRisk(double estimatedFraudRisk) {
        DistributionSummary.builder("gl.detection.fraud_risk")
                .register(registry)
                .record(estimatedFraudRisk);
    }

    public void recordRuleFailure(String ruleName) {
        Counter.builder("gl.detection.rule_failures")
                .tag("rule", ruleName)
                .register(registry)
                .increment();
    }
}
