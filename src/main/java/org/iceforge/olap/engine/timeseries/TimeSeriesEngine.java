package org.iceforge.olap.engine.timeseries;

import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.Column;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.ResultColumn;
import org.iceforge.olap.data.ResultRow;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowGroup;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.engine.aggregate.AggregationEngine;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.semantic.FieldRef;
import org.iceforge.olap.semantic.MeasureRef;
import org.iceforge.olap.semantic.TimeGrain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Buckets rows by a calendar grain, aggregates each bucket and optionally fills gaps and adds period-over-period
 * comparison columns.
 * <p>
 * Bucketing is done by appending the truncated bucket as an extra column and delegating the grouping to the
 * {@link AggregationEngine}, so measures behave exactly as in a plain aggregation.
 */
public class TimeSeriesEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeSeriesEngine.class);

    static final String PRIOR_SUFFIX = "_prior";
    static final String DELTA_SUFFIX = "_delta";
    static final String PCT_CHANGE_SUFFIX = "_pct_change";
    static final String MOVING_AVG_SUFFIX = "_ma3";
    static final String TREND_SUFFIX = "_trend";

    static final String UP = "up";
    static final String DOWN = "down";
    static final String STABLE = "stable";

    private static final List<String> SUMMARY_STATS = List.of("count", "min", "max", "sum", "avg", "first", "last",
            "total_change");

    private static final String BUCKET_COLUMN = "__bucket";

    private final AggregationEngine aggregationEngine;

    public TimeSeriesEngine(AggregationEngine aggregationEngine) {
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine);
    }

    public ResultTable timeSeries(RowSet rows, FieldRef timeField, TimeGrain grain, List<MeasureRef> measures,
                                  TimeSeriesOptions options) {
        Objects.requireNonNull(grain, "grain");
        TimeSeriesOptions opts = options == null ? TimeSeriesOptions.DEFAULTS : options;
        PeriodComparison comparison = opts.comparison();
        if (comparison != null && !comparison.supports(grain)) {
            throw new InvalidArgumentException("Comparison " + comparison + " cannot be applied to "
                    + grain.label() + " buckets");
        }
        if (opts.rangeStart() != null && opts.rangeEnd() != null && opts.rangeStart().isAfter(opts.rangeEnd())) {
            throw new InvalidArgumentException("Date range start " + opts.rangeStart() + " is after its end "
                    + opts.rangeEnd());
        }

        // Prior periods may lie before the range, so comparisons read from an aggregation over every row.
        ResultTable all = bucketed(rows, timeField, grain, measures, opts.seriesBy(), null);
        ResultTable current = opts.rangeStart() == null && opts.rangeEnd() == null ? all
                : bucketed(rows, timeField, grain, measures, opts.seriesBy(), opts);
        Map<List<Object>, List<Object>> priors = index(all, opts.seriesBy().size());
        Map<List<Object>, List<Object>> observed = index(current, opts.seriesBy().size());

        TreeSet<List<Object>> seriesKeys = new TreeSet<>(CellValues.keyComparator(aggregationEngine.getNullOrdering()));
        LocalDateTime first = null;
        LocalDateTime last = null;
        for (List<Object> k : observed.keySet()) {
            LocalDateTime bucket = (LocalDateTime) k.get(0);
            seriesKeys.add(k.subList(1, k.size()));
            first = first == null || bucket.isBefore(first) ? bucket : first;
            last = last == null || bucket.isAfter(last) ? bucket : last;
        }
        if (opts.rangeStart() != null) {
            first = grain.truncate(opts.rangeStart());
        }
        if (opts.rangeEnd() != null) {
            last = grain.truncate(opts.rangeEnd());
        }
        if (seriesKeys.isEmpty() && opts.seriesBy().isEmpty()) {
            seriesKeys.add(List.of());
        }

        List<LocalDateTime> spine = new ArrayList<>();
        if (first != null && last != null) {
            if (opts.fillGaps()) {
                for (LocalDateTime b = first; !b.isAfter(last); b = grain.plus(b, 1)) {
                    spine.add(b);
                }
            } else {
                TreeSet<LocalDateTime> seen = new TreeSet<>();
                for (List<Object> k : observed.keySet()) {
                    seen.add((LocalDateTime) k.get(0));
                }
                spine.addAll(seen);
            }
        }

        Map<List<Object>, Trend> trends = new HashMap<>();
        List<ResultRow> out = new ArrayList<>();
        for (LocalDateTime bucket : spine) {
            for (List<Object> series : seriesKeys) {
                List<Object> values = observed.get(key(bucket, series));
                if (values == null && !opts.fillGaps()) {
                    continue;
                }
                List<Object> cells = new ArrayList<>();
                cells.add(bucket);
                cells.addAll(series);
                for (int m = 0; m < measures.size(); m++) {
                    cells.add(values == null ? null : values.get(m));
                }
                if (comparison != null) {
                    List<Object> prior = priors.get(key(priorBucket(bucket, grain, comparison), series));
                    for (int m = 0; m < measures.size(); m++) {
                        appendComparison(cells, values == null ? null : values.get(m),
                                prior == null ? null : prior.get(m));
                    }
                }
                if (opts.trend()) {
                    Trend trend = trends.computeIfAbsent(series, s -> new Trend(measures.size()));
                    for (int m = 0; m < measures.size(); m++) {
                        trend.append(cells, m, values == null ? null : CellValues.toDouble(values.get(m)));
                    }
                }
                out.add(new ResultRow(cells, RowGroup.bucket(bucket, values == null)));
            }
        }
        LOGGER.debug("Time series on {} by {} produced {} rows over {} buckets", timeField.name(), grain.label(),
                out.size(), spine.size());
        return new ResultTable(header(all, timeField, opts), out);
    }

    /**
     * Per series and measure: count, min, max, sum and average of the bucket values, the first and last non-NULL
     * value in time order and {@code total_change = last - first} (0 with fewer than two values). Empty buckets
     * are ignored; a measure without any value has count 0 and NULL elsewhere.
     */
    public ResultTable summary(RowSet rows, FieldRef timeField, TimeGrain grain, List<MeasureRef> measures,
                               TimeSeriesOptions options) {
        TimeSeriesOptions opts = options == null ? TimeSeriesOptions.DEFAULTS : options;
        ResultTable series = timeSeries(rows, timeField, grain, measures, opts);
        int width = opts.seriesBy().size();

        Map<List<Object>, List<List<Double>>> bySeries = new TreeMap<>(
                CellValues.keyComparator(aggregationEngine.getNullOrdering()));
        if (width == 0) {
            bySeries.put(List.of(), emptyLists(measures.size()));
        }
        for (ResultRow r : series.getRows()) {
            List<List<Double>> values = bySeries.computeIfAbsent(new ArrayList<>(r.cells().subList(1, 1 + width)),
                    k -> emptyLists(measures.size()));
            for (int m = 0; m < measures.size(); m++) {
                Double v = CellValues.toDouble(r.get(1 + width + m));
                if (v != null) {
                    values.get(m).add(v);
                }
            }
        }

        List<ResultColumn> header = new ArrayList<>(series.getColumns().subList(1, 1 + width));
        header.add(ResultColumn.dimension("measure", ColumnKind.STRING));
        for (String stat : SUMMARY_STATS) {
            header.add(ResultColumn.derived(stat, ColumnKind.NUMBER));
        }
        List<ResultRow> out = new ArrayList<>();
        for (Map.Entry<List<Object>, List<List<Double>>> e : bySeries.entrySet()) {
            for (int m = 0; m < measures.size(); m++) {
                List<Object> cells = new ArrayList<>(e.getKey());
                cells.add(measures.get(m).name());
                cells.addAll(stats(e.getValue().get(m)));
                out.add(new ResultRow(cells, RowGroup.DETAIL));
            }
        }
        return new ResultTable(header, out);
    }

    private static List<List<Double>> emptyLists(int n) {
        List<List<Double>> lists = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    private static List<Object> stats(List<Double> values) {
        List<Object> cells = new ArrayList<>(SUMMARY_STATS.size());
        cells.add((long) values.size());
        if (values.isEmpty()) {
            for (int i = 1; i < SUMMARY_STATS.size(); i++) {
                cells.add(null);
            }
            return cells;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        double first = values.get(0);
        double last = values.get(values.size() - 1);
        cells.add(min);
        cells.add(max);
        cells.add(sum);
        cells.add(sum / values.size());
        cells.add(first);
        cells.add(last);
        cells.add(values.size() > 1 ? last - first : 0.0);
        return cells;
    }

    /**
     * Bucket start one comparison period before {@code bucket}. Weekly year-over-year matches the ISO week of the
     * previous week-based year.
     */
    static LocalDateTime priorBucket(LocalDateTime bucket, TimeGrain grain, PeriodComparison comparison) {
        if (grain == TimeGrain.WEEK && comparison == PeriodComparison.YOY) {
            long year = bucket.get(IsoFields.WEEK_BASED_YEAR);
            return grain.truncate(bucket.with(IsoFields.WEEK_BASED_YEAR, year - 1));
        }
        return grain.truncate(comparison.period().plus(bucket, -1));
    }

    private ResultTable bucketed(RowSet rows, FieldRef timeField, TimeGrain grain, List<MeasureRef> measures,
                                 List<FieldRef> seriesBy, TimeSeriesOptions range) {
        List<Column> columns = new ArrayList<>(rows.getColumns());
        columns.add(new Column(BUCKET_COLUMN, ColumnKind.TIMESTAMP));
        List<List<Object>> data = new ArrayList<>();
        for (List<Object> row : rows.getRows()) {
            LocalDateTime ts = CellValues.toTimestamp(row.get(timeField.index()));
            if (ts == null || (range != null && !inRange(ts, range))) {
                continue;
            }
            List<Object> extended = new ArrayList<>(row);
            extended.add(grain.truncate(ts));
            data.add(extended);
        }
        List<FieldRef> groupBy = new ArrayList<>();
        groupBy.add(new FieldRef(timeField.name(), rows.getColumns().size(), ColumnKind.TIMESTAMP));
        groupBy.addAll(seriesBy);
        return aggregationEngine.aggregate(RowSet.of(columns, data), groupBy, measures);
    }

    private static boolean inRange(LocalDateTime ts, TimeSeriesOptions opts) {
        if (opts.rangeStart() != null && ts.isBefore(opts.rangeStart())) {
            return false;
        }
        return opts.rangeEnd() == null || !ts.isAfter(opts.rangeEnd());
    }

    private static Map<List<Object>, List<Object>> index(ResultTable bucketed, int seriesWidth) {
        Map<List<Object>, List<Object>> byKey = new HashMap<>();
        for (ResultRow r : bucketed.getRows()) {
            byKey.put(new ArrayList<>(r.cells().subList(0, 1 + seriesWidth)),
                    r.cells().subList(1 + seriesWidth, r.cells().size()));
        }
        return byKey;
    }

    private static void appendComparison(List<Object> cells, Object current, Object prior) {
        Double cur = current instanceof Number n ? n.doubleValue() : null;
        Double pre = prior instanceof Number n ? n.doubleValue() : null;
        Double delta = cur == null || pre == null ? null : cur - pre;
        cells.add(pre);
        cells.add(delta);
        cells.add(delta == null || pre == 0.0 ? null : delta / pre);
    }

    private static List<Object> key(LocalDateTime bucket, List<Object> series) {
        List<Object> key = new ArrayList<>(series.size() + 1);
        key.add(bucket);
        key.addAll(series);
        return key;
    }

    private static List<ResultColumn> header(ResultTable bucketed, FieldRef timeField, TimeSeriesOptions opts) {
        List<ResultColumn> header = new ArrayList<>(bucketed.getColumns());
        header.set(0, ResultColumn.dimension(timeField.name(), ColumnKind.TIMESTAMP));
        List<ResultColumn> measures = bucketed.getColumns().subList(1 + opts.seriesBy().size(),
                bucketed.getColumns().size());
        if (opts.comparison() != null) {
            for (ResultColumn m : measures) {
                header.add(ResultColumn.derived(m.name() + PRIOR_SUFFIX, ColumnKind.NUMBER));
                header.add(ResultColumn.derived(m.name() + DELTA_SUFFIX, ColumnKind.NUMBER));
                header.add(ResultColumn.derived(m.name() + PCT_CHANGE_SUFFIX, ColumnKind.NUMBER));
            }
        }
        if (opts.trend()) {
            for (ResultColumn m : measures) {
                header.add(ResultColumn.derived(m.name() + MOVING_AVG_SUFFIX, ColumnKind.NUMBER));
                header.add(ResultColumn.derived(m.name() + TREND_SUFFIX, ColumnKind.STRING));
            }
        }
        return header;
    }

    /**
     * Moving average over the current and two previous rows of one series, and the direction against the previous
     * row. A NULL on either side of the comparison reads as stable.
     */
    private static final class Trend {

        private final Double[] previous;
        private final Double[] beforePrevious;

        Trend(int measures) {
            previous = new Double[measures];
            beforePrevious = new Double[measures];
        }

        void append(List<Object> cells, int m, Double value) {
            double sum = 0;
            int count = 0;
            for (Double d : new Double[]{value, previous[m], beforePrevious[m]}) {
                if (d != null) {
                    sum += d;
                    count++;
                }
            }
            cells.add(count == 0 ? null : sum / count);
            Double prior = previous[m];
            int c = value == null || prior == null ? 0 : Double.compare(value, prior);
            cells.add(c > 0 ? UP : c < 0 ? DOWN : STABLE);
            beforePrevious[m] = prior;
            previous[m] = value;
        }
    }
}
