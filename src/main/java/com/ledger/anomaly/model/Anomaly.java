package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * A detected anomaly in unified form. Instances are immutable; the review workflow
 * records status changes through {@link #withStatus(ReviewStatus)}.
 */
@Value
@Builder(toBuilder = true)
public class Anomaly {

    String anomalyId;
    String glAccount;
    String glAccountName;
    List<LineItem> lineItems;
    AnomalyType anomalyType;
    Severity severity;

    // 0-100
    double score;

    Instant detectedAt;
    String description;
    AnomalyDetails details;
    String recommendation;

    @With
    @Builder.Default
    ReviewStatus status = ReviewStatus.OPEN;
}
