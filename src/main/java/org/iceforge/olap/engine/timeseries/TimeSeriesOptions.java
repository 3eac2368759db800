package org.iceforge.olap.engine.timeseries;

import org.iceforge.olap.semantic.FieldRef;

import java.time.LocalDateTime;
import java.util.List;

/**
 * @param rangeStart inclusive lower bound; with {@code rangeEnd} it also fixes the gap-filling spine
 * @param rangeEnd   inclusive upper bound
 * @param fillGaps   emit every bucket between the first and last one, missing buckets with NULL measures
 * @param comparison optional period-over-period comparison
 * @param seriesBy   dimensions splitting the output into one series per key over a shared spine
 * @param trend      add a three-bucket moving average and an up/down/stable direction per measure
 */
public record TimeSeriesOptions(LocalDateTime rangeStart,
                                LocalDateTime rangeEnd,
                                boolean fillGaps,
                                PeriodComparison comparison,
                                List<FieldRef> seriesBy,
                                boolean trend) {

    public static final TimeSeriesOptions DEFAULTS = new TimeSeriesOptions(null, null, true, null, List.of(), false);

    public TimeSeriesOptions {
        seriesBy = seriesBy == null ? List.of() : List.copyOf(seriesBy);
    }

    public TimeSeriesOptions withComparison(PeriodComparison comparison) {
        return new TimeSeriesOptions(rangeStart, rangeEnd, fillGaps, comparison, seriesBy, trend);
    }

    public TimeSeriesOptions withTrend() {
        return new TimeSeriesOptions(rangeStart, rangeEnd, fillGaps, comparison, seriesBy, true);
    }
}
