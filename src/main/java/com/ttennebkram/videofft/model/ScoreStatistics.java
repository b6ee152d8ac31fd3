package com.ttennebkram.videofft.model;

import java.util.Arrays;

/**
 * Distribution of high-frequency scores across a sequence.
 * Percentiles use the midpoint rule: the mean of the two order statistics
 * bracketing position p / 100 * (n - 1).
 */
public class ScoreStatistics {

    private final double mean;
    private final double max;
    private final double min;
    private final double median;
    private final double pct05;
    private final double pct95;

    private ScoreStatistics(double mean, double max, double min, double median, double pct05, double pct95) {
        this.mean = mean;
        this.max = max;
        this.min = min;
        this.median = median;
        this.pct05 = pct05;
        this.pct95 = pct95;
    }

    public static ScoreStatistics of(double[] scores) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No scores to summarize");
        }
        double[] sorted = scores.clone();
        Arrays.sort(sorted);

        double total = 0;
        for (double s : scores) {
            total += s;
        }
        int n = sorted.length;
        double median = (n % 2 == 1)
            ? sorted[n / 2]
            : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;

        return new ScoreStatistics(
            total / n,
            sorted[n - 1],
            sorted[0],
            median,
            midpointPercentile(sorted, 5),
            midpointPercentile(sorted, 95));
    }

    static double midpointPercentile(double[] sorted, double percentile) {
        double position = percentile / 100.0 * (sorted.length - 1);
        int below = (int) Math.floor(position);
        int above = (int) Math.ceil(position);
        if (below == above) {
            return sorted[below];
        }
        return (sorted[below] + sorted[above]) / 2.0;
    }

    public double getMean() { return mean; }
    public double getMax() { return max; }
    public double getMin() { return min; }
    public double getMedian() { return median; }
    public double getPct05() { return pct05; }
    public double getPct95() { return pct95; }

    @Override
    public String toString() {
        return String.format("mean=%.3f min=%.3f max=%.3f median=%.3f p05=%.3f p95=%.3f",
            mean, min, max, median, pct05, pct95);
    }
}
