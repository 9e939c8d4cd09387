package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OutlierObservation {

    LineItem lineItem;
    OutlierMethod method;
    double score;
    double threshold;
    double deviation;

    // Z-Score only
    Double populationMean;
    Double populationStd;
}
