package com.ledger.anomaly.engine.statistics;

import java.util.Arrays;

/**
 * Descriptive statistics over amounts. Every function returns 0 for an empty input;
 * callers that need to tell "no data" from "zero" must check emptiness themselves.
 */
public final class Statistics {

    private Statistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation: square root of the mean squared deviation.
     */
    public static double standardDeviation(double[] values) {
        return standardDeviation(values, mean(values));
    }

    public static double standardDeviation(double[] values, double mean) {
        if (values.length == 0) return 0.0;
        double squaredDiffs = 0.0;
        for (double v : values) {
            squaredDiffs += (v - mean) * (v - mean);
        }
        return Math.sqrt(squaredDiffs / values.length);
    }

    public static double median(double[] values) {
        if (values.length == 0) return 0.0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return medianOfSorted(sorted, 0, sorted.length);
    }

    /**
     * Quartiles by median of halves. The halves split at length/2; for an odd length
     * the middle element belongs to neither half.
     */
    public static Quartiles quartiles(double[] values) {
        if (values.length == 0) {
            return new Quartiles(0.0, 0.0, 0.0);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        int n = sorted.length;
        int mid = n / 2;
        double q2 = medianOfSorted(sorted, 0, n);
        double q1 = medianOfSorted(sorted, 0, mid);
        double q3 = (n % 2 == 0)
                ? medianOfSorted(sorted, mid, n)
                : medianOfSorted(sorted, mid + 1, n);
        return new Quartiles(q1, q2, q3);
    }

    public static double iqr(double[] values) {
        return quartiles(values).getIqr();
    }

    /**
     * Median absolute deviation from the median.
     */
    public static double mad(double[] values) {
        if (values.length == 0) return 0.0;
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    public static double min(double[] values) {
        if (values.length == 0) return 0.0;
        return Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        if (values.length == 0) return 0.0;
        return Arrays.stream(values).max().getAsDouble();
    }

    // Median of sorted[from, to); 0 for an empty range
    private static double medianOfSorted(double[] sorted, int from, int to) {
        int len = to - from;
        if (len <= 0) return 0.0;
        int mid = from + len / 2;
        if (len % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }
}
