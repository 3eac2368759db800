package org.iceforge.olap.engine.stats;

/**
 * Exactly one of {@code binCount} and {@code binWidth} must be set. Without explicit bounds the observed minimum
 * and maximum are used.
 */
public record HistogramSpec(Integer binCount, Double binWidth, Double min, Double max) {

    public static HistogramSpec bins(int binCount) {
        return new HistogramSpec(binCount, null, null, null);
    }

    public static HistogramSpec width(double binWidth) {
        return new HistogramSpec(null, binWidth, null, null);
    }
}
