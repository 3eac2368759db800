package org.iceforge.olap.engine.stats;

import java.util.Arrays;
import java.util.List;

/**
 * Sorted non-NULL values of one numeric column.
 */
final class Sample {

    private final double[] sorted;
    private final double sum;

    private Sample(double[] sorted) {
        this.sorted = sorted;
        double s = 0;
        for (double v : sorted) {
            s += v;
        }
        this.sum = s;
    }

    static Sample of(List<Double> values) {
        double[] v = values.stream().filter(d -> d != null && !d.isNaN()).mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(v);
        return new Sample(v);
    }

    int count() {
        return sorted.length;
    }

    boolean isEmpty() {
        return sorted.length == 0;
    }

    long distinctCount() {
        return Arrays.stream(sorted).distinct().count();
    }

    Double sum() {
        return isEmpty() ? null : sum;
    }

    Double mean() {
        return isEmpty() ? null : sum / sorted.length;
    }

    Double min() {
        return isEmpty() ? null : sorted[0];
    }

    Double max() {
        return isEmpty() ? null : sorted[sorted.length - 1];
    }

    /**
     * Sample variance with n - 1 in the denominator.
     */
    Double variance() {
        if (sorted.length < 2) {
            return null;
        }
        return centralMoment(2) * sorted.length / (sorted.length - 1);
    }

    Double stddev() {
        Double v = variance();
        return v == null ? null : Math.sqrt(v);
    }

    /**
     * Population central moment {@code m_k = sum((x - mean)^k) / n}.
     */
    double centralMoment(int k) {
        double mean = sum / sorted.length;
        double acc = 0;
        for (double v : sorted) {
            acc += Math.pow(v - mean, k);
        }
        return acc / sorted.length;
    }

    Double percentile(double q, PercentileMethod method) {
        if (isEmpty()) {
            return null;
        }
        int n = sorted.length;
        if (method == PercentileMethod.NEAREST_RANK) {
            int rank = (int) Math.ceil(q * n);
            return sorted[Math.min(n, Math.max(1, rank)) - 1];
        }
        double p = (n - 1) * q;
        int lo = (int) Math.floor(p);
        int hi = (int) Math.ceil(p);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (p - lo);
    }

    double[] values() {
        return sorted;
    }
}
