package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * First-digit analysis of one GL account against Benford's Law.
 * Distributions are keyed by digit (1-9) and expressed as percentages.
 */
@Value
@Builder
public class BenfordResult {

    String glAccount;

    // Non-zero amounts that contributed a leading digit
    long totalTransactions;

    Map<Integer, Long> firstDigitCounts;
    Map<Integer, Double> expectedDistribution;
    Map<Integer, Double> actualDistribution;
    double chiSquareStatistic;
    double pValue;
    boolean anomalous;
    Severity severity;

    int largestDeviationDigit;
    double largestDeviation;
}
