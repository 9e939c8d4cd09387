package com.ledger.anomaly.service;

import com.ledger.anomaly.model.AccountRiskProfile;
import com.ledger.anomaly.model.AccountStats;
import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BenfordResult;
import com.ledger.anomaly.model.DetectionResult;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.RiskFactor;
import com.ledger.anomaly.model.RiskLevel;
import com.ledger.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a risk profile for a single GL account from a detection run scoped to it.
 *
 * Risk score: 25 per CRITICAL, 15 per HIGH and 5 per MEDIUM anomaly, capped at 100.
 */
@Service
public class AccountRiskProfileService {

    private static final Logger log = LoggerFactory.getLogger(AccountRiskProfileService.class);

    private static final int MAX_RISK_FACTORS = 5;

    private final GLAnomalyDetectionService detectionService;
    private final Clock clock;

    public AccountRiskProfileService(GLAnomalyDetectionService detectionService, Clock clock) {
        this.detectionService = detectionService;
        this.clock = clock;
    }

    public AccountRiskProfile analyzeAccount(String tenantId, String glAccount,
                                             String fiscalYear, String fiscalPeriod) {
        DetectionResult result = detectionService.detectAnomalies(tenantId,
                GLFilter.forAccount(glAccount, fiscalYear, fiscalPeriod));
        AccountRiskProfile profile = buildProfile(glAccount, result);
        log.info("Risk profile for GL account {}: score={}, level={}, anomalies={}",
                glAccount, profile.getRiskScore(), profile.getRiskLevel(), profile.getAnomalyCount());
        return profile;
    }

    AccountRiskProfile buildProfile(String glAccount, DetectionResult result) {
        List<Anomaly> anomalies = result.getAnomalies().stream()
                .filter(a -> glAccount.equals(a.getGlAccount()))
                .collect(Collectors.toList());

        long critical = count(anomalies, Severity.CRITICAL);
        long high = count(anomalies, Severity.HIGH);
        long medium = count(anomalies, Severity.MEDIUM);
        double riskScore = Math.min(100.0, critical * 25.0 + high * 15.0 + medium * 5.0);

        List<RiskFactor> riskFactors = anomalies.stream()
                .limit(MAX_RISK_FACTORS)
                .map(a -> RiskFactor.builder()
                        .factor(a.getAnomalyType())
                        .severity(a.getSeverity())
                        .description(a.getDescription())
                        .impact(impact(a.getSeverity()))
                        .build())
                .collect(Collectors.toList());

        return AccountRiskProfile.builder()
                .glAccount(glAccount)
                .glAccountName(accountName(glAccount, result))
                .riskScore(riskScore)
                .riskLevel(RiskLevel.fromScore(riskScore))
                .riskFactors(riskFactors)
                .anomalyCount(anomalies.size())
                .criticalAnomalyCount(critical)
                .benfordComplianceScore(benfordCompliance(glAccount, result))
                .controlWeaknesses(controlWeaknesses(anomalies))
                .recommendations(recommendations(anomalies, critical))
                .lastAssessedAt(clock.instant())
                .build();
    }

    static int impact(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return 10;
            case HIGH:
                return 7;
            case MEDIUM:
                return 4;
            default:
                return 2;
        }
    }

    static List<String> controlWeaknesses(List<Anomaly> anomalies) {
        List<String> weaknesses = new ArrayList<>();
        if (hasType(anomalies, AnomalyType.AFTER_HOURS_POSTING)) {
            weaknesses.add("Inadequate access controls for after-hours postings");
        }
        if (hasType(anomalies, AnomalyType.DUPLICATE_ENTRY)) {
            weaknesses.add("Weak duplicate detection controls");
        }
        if (hasType(anomalies, AnomalyType.BENFORD_LAW_VIOLATION)) {
            weaknesses.add("Potential data manipulation or estimation practices");
        }
        return weaknesses;
    }

    static List<String> recommendations(List<Anomaly> anomalies, long critical) {
        List<String> recommendations = new ArrayList<>();
        if (critical > 0) {
            recommendations.add("URGENT: Investigate " + critical + " critical anomalies immediately");
        }
        if (hasType(anomalies, AnomalyType.BENFORD_LAW_VIOLATION)) {
            recommendations.add("Review data entry processes and potential estimation biases");
        }
        if (hasType(anomalies, AnomalyType.AFTER_HOURS_POSTING)) {
            recommendations.add("Strengthen access controls for after-hours postings");
        }
        if (hasType(anomalies, AnomalyType.DUPLICATE_ENTRY)) {
            recommendations.add("Implement automated duplicate detection in source systems");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Continue regular monitoring - no critical issues detected");
        }
        return recommendations;
    }

    private static Double benfordCompliance(String glAccount, DetectionResult result) {
        if (result.getBenfordAnalysis() == null) return null;
        for (BenfordResult benford : result.getBenfordAnalysis()) {
            if (glAccount.equals(benford.getGlAccount())) {
                return benford.getPValue() * 100.0;
            }
        }
        return null;
    }

    private static String accountName(String glAccount, DetectionResult result) {
        for (AccountStats stats : result.getAccountStats()) {
            if (glAccount.equals(stats.getGlAccount()) && stats.getGlAccountName() != null) {
                return stats.getGlAccountName();
            }
        }
        return "";
    }

    private static long count(List<Anomaly> anomalies, Severity severity) {
        return anomalies.stream().filter(a -> a.getSeverity() == severity).count();
    }

    private static boolean hasType(List<Anomaly> anomalies, AnomalyType type) {
        return anomalies.stream().anyMatch(a -> a.getAnomalyType() == type);
    }
}
