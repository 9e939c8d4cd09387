package com.ledger.anomaly.engine;

import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.AnomalyDetails;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.BenfordResult;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.OutlierObservation;
import com.ledger.anomaly.model.Severity;
import com.ledger.anomaly.model.VelocityObservation;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts detector-specific observations into the unified {@link Anomaly} shape.
 * Ids are derived from content so the same input always yields the same ids;
 * detectedAt comes from the injected clock. Score and confidence are clamped to 0-100.
 */
@Component
public class AnomalyFactory {

    private static final double OUTLIER_CONFIDENCE = 85.0;
    private static final double VELOCITY_CONFIDENCE = 80.0;

    private final Clock clock;

    public AnomalyFactory(Clock clock) {
        this.clock = clock;
    }

    public Anomaly fromOutlier(OutlierObservation outlier) {
        LineItem item = outlier.getLineItem();
        Severity severity = outlierSeverity(outlier.getScore());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("method", outlier.getMethod().name());
        evidence.put("score", outlier.getScore());
        evidence.put("threshold", outlier.getThreshold());
        evidence.put("deviation", outlier.getDeviation());
        if (outlier.getPopulationMean() != null) {
            evidence.put("populationMean", outlier.getPopulationMean());
            evidence.put("populationStd", outlier.getPopulationStd());
        }

        return Anomaly.builder()
                .anomalyId("OUTLIER-" + item.getGlAccount() + "-" + item.getDocumentNumber() + "-" + item.getLineItem())
                .glAccount(item.getGlAccount())
                .glAccountName(nameOf(item))
                .lineItems(List.of(item))
                .anomalyType(AnomalyType.STATISTICAL_OUTLIER)
                .severity(severity)
                .score(clamp(outlier.getScore() * 20))
                .detectedAt(clock.instant())
                .description(String.format("Unusual amount detected: %,.2f %s (%s score: %.2f)",
                        item.getAbsAmount(), item.getCurrency(), outlier.getMethod(), outlier.getScore()))
                .details(AnomalyDetails.builder()
                        .actualValue(item.getAbsAmount())
                        .deviation(outlier.getDeviation())
                        .confidence(OUTLIER_CONFIDENCE)
                        .evidence(frozen(evidence))
                        .build())
                .recommendation(severity == Severity.CRITICAL
                        ? "URGENT: Investigate unusual transaction amount"
                        : "Review transaction for legitimacy")
                .build();
    }

    public Anomaly fromBenford(BenfordResult result, List<LineItem> accountItems) {
        int digit = result.getLargestDeviationDigit();
        double expected = result.getExpectedDistribution().getOrDefault(digit, 0.0);
        double actual = result.getActualDistribution().getOrDefault(digit, 0.0);
        double confidence = clamp((1 - result.getPValue()) * 100);

        Map<String, Object> largest = new LinkedHashMap<>();
        largest.put("digit", digit);
        largest.put("expected", expected);
        largest.put("actual", actual);
        largest.put("deviation", result.getLargestDeviation());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("chiSquareStatistic", result.getChiSquareStatistic());
        evidence.put("pValue", result.getPValue());
        evidence.put("totalTransactions", result.getTotalTransactions());
        evidence.put("largestDeviation", largest);
        evidence.put("fullDistribution", result.getActualDistribution());

        return Anomaly.builder()
                .anomalyId("BENFORD-" + result.getGlAccount())
                .glAccount(result.getGlAccount())
                .glAccountName(accountItems.isEmpty() ? "" : nameOf(accountItems.get(0)))
                .lineItems(accountItems)
                .anomalyType(AnomalyType.BENFORD_LAW_VIOLATION)
                .severity(result.getSeverity())
                .score(confidence)
                .detectedAt(clock.instant())
                .description(String.format(
                        "GL account %s shows significant deviation from Benford's Law. "
                                + "Digit %d appears %.1f%% of the time (expected: %.1f%%). "
                                + "Chi-Square: %.2f, p-value: %.4f",
                        result.getGlAccount(), digit, actual, expected,
                        result.getChiSquareStatistic(), result.getPValue()))
                .details(AnomalyDetails.builder()
                        .expectedValue(result.getExpectedDistribution())
                        .actualValue(result.getActualDistribution())
                        .deviation(result.getLargestDeviation())
                        .confidence(confidence)
                        .evidence(frozen(evidence))
                        .build())
                .recommendation(result.getSeverity().isAtLeast(Severity.HIGH)
                        ? "URGENT: Investigate for potential fraud or systematic data manipulation"
                        : "Review transaction patterns for data quality issues or unusual behavior")
                .build();
    }

    public Anomaly fromBehavioral(BehavioralMatch match) {
        return Anomaly.builder()
                .anomalyId(tag(match.getAnomalyType()) + "-" + match.getGlAccount() + "-" + match.getKey())
                .glAccount(match.getGlAccount())
                .glAccountName(match.getGlAccountName())
                .lineItems(match.getLineItems())
                .anomalyType(match.getAnomalyType())
                .severity(match.getSeverity())
                .score(clamp(match.getScore()))
                .detectedAt(clock.instant())
                .description(match.getDescription())
                .details(AnomalyDetails.builder()
                        .confidence(clamp(match.getConfidence()))
                        .evidence(frozen(match.getEvidence()))
                        .build())
                .recommendation(match.getRecommendation())
                .build();
    }

    public Anomaly fromVelocity(VelocityObservation velocity, List<LineItem> accountItems) {
        List<LineItem> periodItems = accountItems.stream()
                .filter(i -> velocity.getPeriod().equals(i.getPeriodKey()))
                .collect(Collectors.toList());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("period", velocity.getPeriod());
        evidence.put("transactionCount", velocity.getTransactionCount());
        evidence.put("averageCount", velocity.getAverageTransactionCount());
        evidence.put("totalAmount", velocity.getTotalAmount());
        evidence.put("averageAmount", velocity.getAverageAmount());
        evidence.put("countDeviation", velocity.getCountDeviation());
        evidence.put("amountDeviation", velocity.getAmountDeviation());

        return Anomaly.builder()
                .anomalyId("VELOCITY-" + velocity.getGlAccount() + "-" + velocity.getPeriod())
                .glAccount(velocity.getGlAccount())
                .glAccountName(accountItems.isEmpty() ? "" : nameOf(accountItems.get(0)))
                .lineItems(periodItems)
                .anomalyType(AnomalyType.VELOCITY_ANOMALY)
                .severity(velocity.getSeverity())
                .score(clamp(velocity.getMaxDeviation() / 5))
                .detectedAt(clock.instant())
                .description(String.format(
                        "Unusual transaction velocity in period %s: %d transactions (%+.0f%% vs avg)",
                        velocity.getPeriod(), velocity.getTransactionCount(), velocity.getCountDeviation()))
                .details(AnomalyDetails.builder()
                        .expectedValue(velocity.getAverageTransactionCount())
                        .actualValue(velocity.getTransactionCount())
                        .deviation(velocity.getMaxDeviation())
                        .confidence(VELOCITY_CONFIDENCE)
                        .evidence(frozen(evidence))
                        .build())
                .recommendation("Investigate sudden change in transaction patterns")
                .build();
    }

    static Severity outlierSeverity(double score) {
        if (score > 5) return Severity.CRITICAL;
        if (score > 3) return Severity.HIGH;
        return Severity.MEDIUM;
    }

    // Copies so later changes to a detector's map never reach a produced anomaly
    static Map<String, Object> frozen(Map<String, Object> evidence) {
        if (evidence == null || evidence.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static String tag(AnomalyType type) {
        switch (type) {
            case AFTER_HOURS_POSTING:
                return "AFTER_HOURS";
            case WEEKEND_POSTING:
                return "WEEKEND";
            case SAME_DAY_REVERSAL:
                return "REVERSAL";
            case ROUND_NUMBER_PATTERN:
                return "ROUND_NUMBER";
            case DUPLICATE_ENTRY:
                return "DUPLICATE";
            default:
                return type.name();
        }
    }

    private static String nameOf(LineItem item) {
        return item.getGlAccountName() == null ? "" : item.getGlAccountName();
    }
}
