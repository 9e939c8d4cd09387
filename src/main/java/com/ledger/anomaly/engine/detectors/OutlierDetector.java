package com.ledger.anomaly.engine.detectors;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.engine.statistics.Quartiles;
import com.ledger.anomaly.engine.statistics.Statistics;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.OutlierMethod;
import com.ledger.anomaly.model.OutlierObservation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flags line items whose absolute amount is statistically extreme within the
 * candidate set. Scores are on method-specific scales and are not comparable
 * across methods.
 *
 * <ul>
 *   <li>Z_SCORE: |z| of the amount against the population mean/std.</li>
 *   <li>IQR: distance outside [Q1 - k*IQR, Q3 + k*IQR], in units of IQR.</li>
 *   <li>MAD: 0.6745 * |x - median| / MAD. Skipped entirely when MAD is 0.</li>
 * </ul>
 */
@Component
public class OutlierDetector {

    static final double MAD_CONSISTENCY_CONSTANT = 0.6745;

    private static final Comparator<OutlierObservation> BY_SCORE_DESC =
            Comparator.comparingDouble(OutlierObservation::getScore).reversed();

    public List<OutlierObservation> detect(List<LineItem> items, DetectionConfig.StatisticalOutliers config) {
        OutlierMethod method = config.getMethod() != null ? config.getMethod() : OutlierMethod.IQR;
        switch (method) {
            case Z_SCORE:
                return detectZScore(items, config.getZScoreThreshold());
            case MAD:
                return detectMad(items, config.getMadThreshold());
            case IQR:
            default:
                return detectIqr(items, config.getIqrMultiplier());
        }
    }

    public List<OutlierObservation> detectZScore(List<LineItem> items, double threshold) {
        double[] amounts = absAmounts(items);
        double mean = Statistics.mean(amounts);
        double std = Statistics.standardDeviation(amounts, mean);

        List<OutlierObservation> outliers = new ArrayList<>();
        for (LineItem item : items) {
            double value = item.getAbsAmount();
            double z = std == 0 ? 0.0 : (value - mean) / std;
            if (Math.abs(z) > threshold) {
                outliers.add(OutlierObservation.builder()
                        .lineItem(item)
                        .method(OutlierMethod.Z_SCORE)
                        .score(Math.abs(z))
                        .threshold(threshold)
                        .deviation(Math.abs(value - mean))
                        .populationMean(mean)
                        .populationStd(std)
                        .build());
            }
        }
        outliers.sort(BY_SCORE_DESC);
        return outliers;
    }

    public List<OutlierObservation> detectIqr(List<LineItem> items, double multiplier) {
        Quartiles quartiles = Statistics.quartiles(absAmounts(items));
        double iqr = quartiles.getIqr();
        double lowerBound = quartiles.getQ1() - multiplier * iqr;
        double upperBound = quartiles.getQ3() + multiplier * iqr;

        List<OutlierObservation> outliers = new ArrayList<>();
        for (LineItem item : items) {
            double value = item.getAbsAmount();
            if (value >= lowerBound && value <= upperBound) {
                continue;
            }
            double deviation = value > upperBound ? value - upperBound : lowerBound - value;
            outliers.add(OutlierObservation.builder()
                    .lineItem(item)
                    .method(OutlierMethod.IQR)
                    .score(iqr > 0 ? deviation / iqr : 0.0)
                    .threshold(multiplier)
                    .deviation(deviation)
                    .build());
        }
        outliers.sort(BY_SCORE_DESC);
        return outliers;
    }

    public List<OutlierObservation> detectMad(List<LineItem> items, double threshold) {
        double[] amounts = absAmounts(items);
        double mad = Statistics.mad(amounts);
        if (mad == 0) {
            return new ArrayList<>();
        }
        double median = Statistics.median(amounts);

        List<OutlierObservation> outliers = new ArrayList<>();
        for (LineItem item : items) {
            double value = item.getAbsAmount();
            double madZ = MAD_CONSISTENCY_CONSTANT * Math.abs(value - median) / mad;
            if (madZ > threshold) {
                outliers.add(OutlierObservation.builder()
                        .lineItem(item)
                        .method(OutlierMethod.MAD)
                        .score(madZ)
                        .threshold(threshold)
                        .deviation(Math.abs(value - median))
                        .build());
            }
        }
        outliers.sort(BY_SCORE_DESC);
        return outliers;
    }

    static double[] absAmounts(List<LineItem> items) {
        double[] amounts = new double[items.size()];
        for (int i = 0; i < amounts.length; i++) {
            amounts[i] = items.get(i).getAbsAmount();
        }
        return amounts;
    }
}
