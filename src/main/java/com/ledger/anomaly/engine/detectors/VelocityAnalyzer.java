package com.ledger.anomaly.engine.detectors;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.Severity;
import com.ledger.anomaly.model.VelocityObservation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares each fiscal period's transaction count and total absolute amount with the
 * trailing average of up to {@code lookbackPeriods} preceding periods of the same account.
 *
 * Deviation = (observed - average) / average * 100, computed for count and amount.
 * A period is reported when the larger of the two absolute deviations exceeds the threshold.
 */
@Component
public class VelocityAnalyzer {

    // Numeric values first in numeric order, then everything else as text
    static final Comparator<String> NUMERIC_AWARE = (a, b) -> {
        Long left = numericValue(a);
        Long right = numericValue(b);
        if (left != null && right != null) {
            int byValue = Long.compare(left, right);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (left != null) return -1;
        if (right != null) return 1;
        return a.compareTo(b);
    };

    private static final Comparator<LineItem> PERIOD_ORDER =
            Comparator.comparing(LineItem::getFiscalYear, NUMERIC_AWARE)
                    .thenComparing(LineItem::getFiscalPeriod, NUMERIC_AWARE);

    public List<VelocityObservation> analyze(List<LineItem> items, String glAccount,
                                             DetectionConfig.VelocityAnalysis config) {
        Map<String, List<LineItem>> byPeriod = groupByPeriod(items);
        if (byPeriod.size() < 2) {
            return new ArrayList<>();
        }

        List<String> periods = new ArrayList<>(byPeriod.keySet());
        long[] counts = new long[periods.size()];
        double[] amounts = new double[periods.size()];
        for (int i = 0; i < periods.size(); i++) {
            List<LineItem> periodItems = byPeriod.get(periods.get(i));
            counts[i] = periodItems.size();
            amounts[i] = periodItems.stream().mapToDouble(LineItem::getAbsAmount).sum();
        }

        int lookback = Math.max(1, config.getLookbackPeriods());
        List<VelocityObservation> observations = new ArrayList<>();

        for (int i = 1; i < periods.size(); i++) {
            int from = Math.max(0, i - lookback);
            int window = i - from;
            double avgCount = 0.0;
            double avgAmount = 0.0;
            for (int j = from; j < i; j++) {
                avgCount += counts[j];
                avgAmount += amounts[j];
            }
            avgCount /= window;
            avgAmount /= window;

            double countDeviation = percentChange(counts[i], avgCount);
            double amountDeviation = percentChange(amounts[i], avgAmount);
            double maxDeviation = Math.max(Math.abs(countDeviation), Math.abs(amountDeviation));

            if (maxDeviation > config.getDeviationThreshold()) {
                observations.add(VelocityObservation.builder()
                        .glAccount(glAccount)
                        .period(periods.get(i))
                        .transactionCount(counts[i])
                        .totalAmount(amounts[i])
                        .averageTransactionCount(avgCount)
                        .averageAmount(avgAmount)
                        .countDeviation(countDeviation)
                        .amountDeviation(amountDeviation)
                        .severity(severity(maxDeviation))
                        .build());
            }
        }
        return observations;
    }

    /**
     * Items grouped by {@code fiscalYear-fiscalPeriod}, periods in chronological order.
     */
    public static Map<String, List<LineItem>> groupByPeriod(List<LineItem> items) {
        List<LineItem> sorted = new ArrayList<>(items);
        sorted.sort(PERIOD_ORDER);
        Map<String, List<LineItem>> byPeriod = new LinkedHashMap<>();
        for (LineItem item : sorted) {
            byPeriod.computeIfAbsent(item.getPeriodKey(), k -> new ArrayList<>()).add(item);
        }
        return byPeriod;
    }

    static Severity severity(double maxDeviation) {
        if (maxDeviation > 500) return Severity.CRITICAL;
        if (maxDeviation > 300) return Severity.HIGH;
        if (maxDeviation > 200) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private static Long numericValue(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double percentChange(double observed, double average) {
        if (average == 0) return 0.0;
        return (observed - average) / average * 100.0;
    }
}
