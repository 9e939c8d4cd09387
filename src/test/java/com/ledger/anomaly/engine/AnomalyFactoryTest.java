package com.ledger.anomaly.engine;

import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.OutlierMethod;
import com.ledger.anomaly.model.OutlierObservation;
import com.ledger.anomaly.model.ReviewStatus;
import com.ledger.anomaly.model.Severity;
import com.ledger.anomaly.model.VelocityObservation;
import com.ledger.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyFactoryTest {

    private final AnomalyFactory factory = new AnomalyFactory(TestDataFactory.FIXED_CLOCK);

    @Test
    void fromOutlier_scalesScoreAndDerivesSeverity() {
        LineItem item = TestDataFactory.createLineItem("D1", "600100", 50_000);
        OutlierObservation outlier = OutlierObservation.builder()
                .lineItem(item)
                .method(OutlierMethod.IQR)
                .score(4.0)
                .threshold(1.5)
                .deviation(400)
                .build();

        Anomaly anomaly = factory.fromOutlier(outlier);

        assertThat(anomaly.getAnomalyId()).isEqualTo("OUTLIER-600100-D1-001");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getScore()).isEqualTo(80.0);
        assertThat(anomaly.getDetails().getConfidence()).isEqualTo(85.0);
        assertThat(anomaly.getStatus()).isEqualTo(ReviewStatus.OPEN);
        assertThat(anomaly.getDetectedAt()).isEqualTo(TestDataFactory.FIXED_CLOCK.instant());
        assertThat(anomaly.getDetails().getEvidence()).doesNotContainKey("populationMean");
    }

    @Test
    void fromOutlier_extremeScoreClampedTo100_andCritical() {
        OutlierObservation outlier = OutlierObservation.builder()
                .lineItem(TestDataFactory.createLineItem("D1", "600100", 1))
                .method(OutlierMethod.MAD)
                .score(42.0)
                .build();

        Anomaly anomaly = factory.fromOutlier(outlier);

        assertThat(anomaly.getScore()).isEqualTo(100.0);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getRecommendation()).startsWith("URGENT");
    }

    @Test
    void fromBehavioral_usesTypeTagAccountAndKey() {
        BehavioralMatch match = BehavioralMatch.builder()
                .anomalyType(AnomalyType.AFTER_HOURS_POSTING)
                .key("U7")
                .glAccount("410000")
                .glAccountName("Revenue")
                .lineItems(List.of(TestDataFactory.createLineItem("D1", "410000", 10)))
                .severity(Severity.LOW)
                .score(120)
                .confidence(95)
                .evidence(Map.of("userId", "U7"))
                .build();

        Anomaly anomaly = factory.fromBehavioral(match);

        assertThat(anomaly.getAnomalyId()).isEqualTo("AFTER_HOURS-410000-U7");
        assertThat(anomaly.getScore()).isEqualTo(100.0);
        assertThat(anomaly.getDetails().getEvidence()).containsEntry("userId", "U7");
    }

    @Test
    void fromVelocity_attachesOnlyThatPeriodsItems() {
        LineItem april = TestDataFactory.createLineItem("D1", "600100", 10);
        LineItem may = TestDataFactory.lineItemBuilder("D2", "600100", 10).fiscalPeriod("005").build();
        VelocityObservation velocity = VelocityObservation.builder()
                .glAccount("600100")
                .period("2024-005")
                .transactionCount(1)
                .countDeviation(350)
                .amountDeviation(-20)
                .severity(Severity.HIGH)
                .build();

        Anomaly anomaly = factory.fromVelocity(velocity, List.of(april, may));

        assertThat(anomaly.getAnomalyId()).isEqualTo("VELOCITY-600100-2024-005");
        assertThat(anomaly.getLineItems()).containsExactly(may);
        assertThat(anomaly.getScore()).isEqualTo(70.0);
        assertThat(anomaly.getDetails().getConfidence()).isEqualTo(80.0);
    }

    @Test
    void withStatus_returnsReviewedCopy() {
        Anomaly anomaly = factory.fromOutlier(OutlierObservation.builder()
                .lineItem(TestDataFactory.createLineItem("D1", "600100", 1))
                .method(OutlierMethod.IQR)
                .score(2.0)
                .build());

        Anomaly confirmed = anomaly.withStatus(ReviewStatus.CONFIRMED);

        assertThat(confirmed.getStatus()).isEqualTo(ReviewStatus.CONFIRMED);
        assertThat(anomaly.getStatus()).isEqualTo(ReviewStatus.OPEN);
    }

    @Test
    void fromBehavioral_evidenceDetachedFromMatchAndReadOnly() {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("userId", "U7");
        BehavioralMatch match = BehavioralMatch.builder()
                .anomalyType(AnomalyType.WEEKEND_POSTING)
                .key("U7")
                .glAccount("410000")
                .lineItems(List.of(TestDataFactory.createLineItem("D1", "410000", 10)))
                .severity(Severity.LOW)
                .score(10)
                .confidence(90)
                .evidence(evidence)
                .build();

        Anomaly anomaly = factory.fromBehavioral(match);
        evidence.put("postingCount", 3);

        Map<String, Object> stored = anomaly.getDetails().getEvidence();
        assertThat(stored).containsOnlyKeys("userId");
        assertThatThrownBy(() -> stored.put("userId", "U8"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
