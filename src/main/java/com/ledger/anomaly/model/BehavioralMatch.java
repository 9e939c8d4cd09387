package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of a single pattern rule for one account: the matched line items plus
 * the rule's own severity, score and explanation.
 */
@Value
@Builder
public class BehavioralMatch {

    AnomalyType anomalyType;

    // Stable discriminator within the account (user id, document number, ...)
    String key;

    String glAccount;
    String glAccountName;
    List<LineItem> lineItems;
    Severity severity;
    double score;
    double confidence;
    String description;
    String recommendation;
    Map<String, Object> evidence;
}
