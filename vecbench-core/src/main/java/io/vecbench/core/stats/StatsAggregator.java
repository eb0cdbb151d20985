package io.vecbench.core.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary statistics over benchmark samples.
 *
 * <p>Percentiles use the nearest-rank method and never interpolate. The 95% confidence
 * interval uses z = 1.96 from 30 samples upward and a single t value of 2.093 below that,
 * which is the t critical value for 19 degrees of freedom applied to every small sample.
 */
public final class StatsAggregator {
    static final double Z_95 = 1.96;
    static final double T_95_SMALL_SAMPLE = 2.093;
    static final int LARGE_SAMPLE_SIZE = 30;

    private StatsAggregator() {
    }

    public static double mean(List<Double> xs) {
        requireNonEmpty(xs);
        double sum = 0.0;
        for (double x : xs) {
            sum += x;
        }
        return sum / xs.size();
    }

    public static double sampleStd(List<Double> xs) {
        requireNonEmpty(xs);
        if (xs.size() < 2) {
            throw new InsufficientSampleException("sample standard deviation needs at least 2 values, got " + xs.size());
        }
        double m = mean(xs);
        double squares = 0.0;
        for (double x : xs) {
            squares += (x - m) * (x - m);
        }
        return Math.sqrt(squares / (xs.size() - 1));
    }

    public static double median(List<Double> xs) {
        List<Double> sorted = sorted(xs);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 != 0) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    public static double percentile(List<Double> xs, double p) {
        List<Double> sorted = sorted(xs);
        int index = (int) Math.ceil((p / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    public static ConfidenceInterval ci95(List<Double> xs) {
        double m = mean(xs);
        double standardError = sampleStd(xs) / Math.sqrt(xs.size());
        double t = xs.size() >= LARGE_SAMPLE_SIZE ? Z_95 : T_95_SMALL_SAMPLE;
        return new ConfidenceInterval(m - t * standardError, m + t * standardError);
    }

    public static double min(List<Double> xs) {
        requireNonEmpty(xs);
        return Collections.min(xs);
    }

    public static double max(List<Double> xs) {
        requireNonEmpty(xs);
        return Collections.max(xs);
    }

    private static List<Double> sorted(List<Double> xs) {
        requireNonEmpty(xs);
        List<Double> copy = new ArrayList<>(xs);
        Collections.sort(copy);
        return copy;
    }

    private static void requireNonEmpty(List<Double> xs) {
        if (xs == null || xs.isEmpty()) {
            throw new IllegalArgumentException("statistics require a non-empty sample");
        }
    }
}
