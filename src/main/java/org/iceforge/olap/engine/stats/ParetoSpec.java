package org.iceforge.olap.engine.stats;

/**
 * @param limit          number of rows to return, all when null; cumulative values always refer to the full set
 * @param bottom         rank ascending instead of descending
 * @param classAThreshold cumulative percentage up to which rows are class A
 * @param classBThreshold cumulative percentage up to which rows are class B, above it class C
 */
public record ParetoSpec(Integer limit, boolean bottom, double classAThreshold, double classBThreshold) {

    public static ParetoSpec top(Integer limit) {
        return new ParetoSpec(limit, false, 80.0, 95.0);
    }
}
