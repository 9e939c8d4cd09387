package com.ledger.anomaly.engine.detectors;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.engine.AccountIndex;
import com.ledger.anomaly.model.BenfordResult;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tests the leading-digit distribution of each sufficiently large GL account
 * against Benford's Law using a chi-square statistic over percentages (df = 8).
 *
 * The p-value is a linear interpolation over a fixed df=8 critical-value table rather
 * than an exact inverse CDF; severity thresholds are tuned against this approximation.
 */
@Component
public class BenfordAnalyzer {

    /** P(d) = log10(1 + 1/d), rounded to one decimal place. */
    public static final Map<Integer, Double> EXPECTED_DISTRIBUTION;

    static {
        Map<Integer, Double> expected = new LinkedHashMap<>();
        expected.put(1, 30.1);
        expected.put(2, 17.6);
        expected.put(3, 12.5);
        expected.put(4, 9.7);
        expected.put(5, 7.9);
        expected.put(6, 6.7);
        expected.put(7, 5.8);
        expected.put(8, 5.1);
        expected.put(9, 4.6);
        EXPECTED_DISTRIBUTION = Collections.unmodifiableMap(expected);
    }

    // df=8 critical values, ascending chi-square
    private static final double[] CRITICAL_P = {0.995, 0.99, 0.95, 0.90, 0.50, 0.10, 0.05, 0.01, 0.005};
    private static final double[] CRITICAL_CHI = {1.344, 1.646, 2.733, 3.490, 7.344, 13.362, 15.507, 20.090, 21.955};

    private static final double FLOOR_P_VALUE = 0.001;

    /**
     * Analyzes every account with at least {@code minTransactions} line items, ordered by
     * severity (most severe first) and then by ascending p-value.
     */
    public List<BenfordResult> analyzeAccounts(AccountIndex index, DetectionConfig.BenfordLaw config) {
        List<BenfordResult> results = new ArrayList<>();
        for (Map.Entry<String, List<LineItem>> entry : index.asMap().entrySet()) {
            if (entry.getValue().size() < config.getMinTransactions()) {
                continue;
            }
            results.add(analyze(entry.getValue(), entry.getKey(), config.getSignificanceLevel()));
        }
        results.sort(Comparator.comparing(BenfordResult::getSeverity).reversed()
                .thenComparingDouble(BenfordResult::getPValue));
        return results;
    }

    public BenfordResult analyze(List<LineItem> items, String glAccount, double significanceLevel) {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        for (int d = 1; d <= 9; d++) {
            counts.put(d, 0L);
        }
        long total = 0;
        for (LineItem item : items) {
            int digit = firstDigit(item.getAmount());
            if (digit > 0) {
                counts.merge(digit, 1L, Long::sum);
                total++;
            }
        }

        Map<Integer, Double> actual = new LinkedHashMap<>();
        for (int d = 1; d <= 9; d++) {
            actual.put(d, total > 0 ? counts.get(d) * 100.0 / total : 0.0);
        }

        int largestDigit = 1;
        double largestDeviation = -1.0;
        for (int d = 1; d <= 9; d++) {
            double deviation = Math.abs(actual.get(d) - EXPECTED_DISTRIBUTION.get(d));
            if (deviation > largestDeviation) {
                largestDeviation = deviation;
                largestDigit = d;
            }
        }

        // All-zero accounts carry no digit evidence either way.
        double chiSquare = total > 0 ? chiSquare(actual) : 0.0;
        double pValue = total > 0 ? pValue(chiSquare) : 1.0;
        boolean anomalous = pValue < significanceLevel;

        return BenfordResult.builder()
                .glAccount(glAccount)
                .totalTransactions(total)
                .firstDigitCounts(counts)
                .expectedDistribution(EXPECTED_DISTRIBUTION)
                .actualDistribution(actual)
                .chiSquareStatistic(chiSquare)
                .pValue(pValue)
                .anomalous(anomalous)
                .severity(anomalous ? severity(pValue, largestDeviation) : Severity.LOW)
                .largestDeviationDigit(largestDigit)
                .largestDeviation(largestDeviation)
                .build();
    }

    /**
     * First significant digit (1-9) of |amount|, or 0 for a zero amount.
     */
    public static int firstDigit(double amount) {
        double abs = Math.abs(amount);
        if (abs == 0 || Double.isNaN(abs) || Double.isInfinite(abs)) {
            return 0;
        }
        String plain = BigDecimal.valueOf(abs).toPlainString();
        for (int i = 0; i < plain.length(); i++) {
            char c = plain.charAt(i);
            if (c >= '1' && c <= '9') {
                return c - '0';
            }
        }
        return 0;
    }

    public static double chiSquare(Map<Integer, Double> observedPct) {
        double chiSquare = 0.0;
        for (Map.Entry<Integer, Double> entry : observedPct.entrySet()) {
            double expected = EXPECTED_DISTRIBUTION.get(entry.getKey());
            if (expected > 0) {
                double diff = entry.getValue() - expected;
                chiSquare += diff * diff / expected;
            }
        }
        return chiSquare;
    }

    public static double pValue(double chiSquare) {
        if (chiSquare < CRITICAL_CHI[0]) {
            return 1.0;
        }
        for (int i = 0; i < CRITICAL_CHI.length - 1; i++) {
            double x1 = CRITICAL_CHI[i];
            double x2 = CRITICAL_CHI[i + 1];
            if (chiSquare >= x1 && chiSquare < x2) {
                double y1 = CRITICAL_P[i];
                double y2 = CRITICAL_P[i + 1];
                return y1 + ((chiSquare - x1) / (x2 - x1)) * (y2 - y1);
            }
        }
        return FLOOR_P_VALUE;
    }

    /**
     * @param maxDeviation largest absolute percentage-point gap between observed and expected
     */
    public static Severity severity(double pValue, double maxDeviation) {
        if (pValue < 0.001 && maxDeviation > 10) return Severity.CRITICAL;
        if (pValue < 0.01 && maxDeviation > 7) return Severity.HIGH;
        if (pValue < 0.05 && maxDeviation > 5) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
