package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnomalyDetails {

    Object expectedValue;
    Object actualValue;
    Double deviation;

    // 0-100
    double confidence;

    @Builder.Default
    Map<String, Object> evidence = Collections.emptyMap();

    @Builder.Default
    List<String> relatedAnomalies = Collections.emptyList();
}
