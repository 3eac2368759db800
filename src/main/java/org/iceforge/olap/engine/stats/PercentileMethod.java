package org.iceforge.olap.engine.stats;

/**
 * Percentile estimators over the sorted non-NULL values {@code x[0..n-1]}.
 */
public enum PercentileMethod {

    /**
     * Interpolates between the order statistics around {@code p = (n - 1) * q}, like SQL {@code PERCENTILE_CONT}.
     */
    LINEAR,

    /**
     * Smallest value whose rank {@code r} satisfies {@code r >= ceil(q * n)}, never interpolated.
     */
    NEAREST_RANK
}
