package org.iceforge.olap.engine.aggregate;

/**
 * @param includeTotals append a grand-total column per measure and a grand-total row
 * @param percentageOf  when set, cells are fractions of the chosen total instead of raw aggregates
 */
public record PivotOptions(boolean includeTotals, PercentageOf percentageOf) {

    public static final PivotOptions DEFAULTS = new PivotOptions(true, null);
}
