package org.iceforge.olap.engine.stats;

import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.data.ResultColumn;
import org.iceforge.olap.data.ResultRow;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowGroup;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.semantic.FieldRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Descriptive statistics, distribution analysis and contribution analysis over numeric columns. NULLs are ignored
 * and degenerate inputs (no values, zero variance) produce NULL rather than an error.
 */
public class StatisticsEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatisticsEngine.class);

    public static final List<Double> DEFAULT_PERCENTILES = List.of(0.25, 0.50, 0.75, 0.90, 0.95, 0.99);

    /**
     * Upper bound on histogram bins, whether requested as a count or derived from a bin width.
     */
    public static final int MAX_BINS = 10_000;

    static final String MEASURE = "measure";

    private final PercentileMethod percentileMethod;
    private final NullOrdering nullOrdering;

    public StatisticsEngine(PercentileMethod percentileMethod, NullOrdering nullOrdering) {
        this.percentileMethod = Objects.requireNonNull(percentileMethod);
        this.nullOrdering = Objects.requireNonNull(nullOrdering);
    }

    /**
     * One row per group and measure: count, distinct count, sum, mean, median, sample stddev and variance, min and
     * max.
     */
    public ResultTable summary(RowSet rows, List<FieldRef> groupBy, List<FieldRef> measures) {
        List<FieldRef> groups = groupBy == null ? List.of() : groupBy;
        List<ResultColumn> header = new ArrayList<>();
        for (FieldRef g : groups) {
            header.add(ResultColumn.dimension(g.name(), g.kind()));
        }
        header.add(ResultColumn.dimension(MEASURE, ColumnKind.STRING));
        for (String stat : List.of("count", "distinct_count", "sum", "mean", "median", "stddev", "variance", "min",
                "max")) {
            header.add(ResultColumn.derived(stat, ColumnKind.NUMBER));
        }

        List<ResultRow> out = new ArrayList<>();
        for (Map.Entry<List<Object>, List<List<Object>>> group : partition(rows, groups).entrySet()) {
            for (FieldRef m : measures) {
                Sample s = Sample.of(column(group.getValue(), m));
                List<Object> cells = new ArrayList<>(group.getKey());
                cells.add(m.name());
                cells.add((long) s.count());
                cells.add(s.distinctCount());
                cells.add(s.sum());
                cells.add(s.mean());
                cells.add(s.percentile(0.5, PercentileMethod.LINEAR));
                cells.add(s.stddev());
                cells.add(s.variance());
                cells.add(s.min());
                cells.add(s.max());
                out.add(new ResultRow(cells, groups.isEmpty() ? RowGroup.DETAIL
                        : RowGroup.grouping(names(groups), List.of(), null)));
            }
        }
        return new ResultTable(header, out);
    }

    /**
     * Requested percentiles per measure, plus the interquartile range p75 - p25.
     */
    public ResultTable percentiles(RowSet rows, List<FieldRef> measures, List<Double> quantiles) {
        List<Double> qs = quantiles == null || quantiles.isEmpty() ? DEFAULT_PERCENTILES : quantiles;
        for (Double q : qs) {
            if (q == null || q < 0.0 || q > 1.0) {
                throw new InvalidArgumentException("Percentiles must lie within [0, 1], got " + q);
            }
        }
        List<ResultColumn> header = new ArrayList<>();
        header.add(ResultColumn.dimension(MEASURE, ColumnKind.STRING));
        header.add(ResultColumn.derived("count", ColumnKind.NUMBER));
        for (Double q : qs) {
            header.add(ResultColumn.derived(percentileName(q), ColumnKind.NUMBER));
        }
        header.add(ResultColumn.derived("iqr", ColumnKind.NUMBER));

        List<ResultRow> out = new ArrayList<>();
        for (FieldRef m : measures) {
            Sample s = Sample.of(column(rows.getRows(), m));
            List<Object> cells = new ArrayList<>();
            cells.add(m.name());
            cells.add((long) s.count());
            for (Double q : qs) {
                cells.add(s.percentile(q, percentileMethod));
            }
            cells.add(iqr(s));
            out.add(new ResultRow(cells, RowGroup.DETAIL));
        }
        return new ResultTable(header, out);
    }

    /**
     * Shape of each measure's distribution: skewness {@code g1 = m3 / m2^1.5} and excess kurtosis
     * {@code g2 = m4 / m2^2 - 3} from population central moments.
     */
    public ResultTable distribution(RowSet rows, List<FieldRef> measures) {
        List<ResultColumn> header = new ArrayList<>();
        header.add(ResultColumn.dimension(MEASURE, ColumnKind.STRING));
        for (String stat : List.of("count", "mean", "stddev", "iqr", "skewness", "kurtosis")) {
            header.add(ResultColumn.derived(stat, ColumnKind.NUMBER));
        }
        List<ResultRow> out = new ArrayList<>();
        for (FieldRef m : measures) {
            Sample s = Sample.of(column(rows.getRows(), m));
            Double skewness = null;
            Double kurtosis = null;
            if (!s.isEmpty()) {
                double m2 = s.centralMoment(2);
                if (m2 > 0.0) {
                    skewness = s.centralMoment(3) / Math.pow(m2, 1.5);
                    kurtosis = s.centralMoment(4) / (m2 * m2) - 3.0;
                }
            }
            List<Object> cells = new ArrayList<>();
            cells.add(m.name());
            cells.add((long) s.count());
            cells.add(s.mean());
            cells.add(s.stddev());
            cells.add(iqr(s));
            cells.add(skewness);
            cells.add(kurtosis);
            out.add(new ResultRow(cells, RowGroup.DETAIL));
        }
        return new ResultTable(header, out);
    }

    /**
     * Pearson correlation matrix. Each pair uses only the rows where both values are present.
     */
    public ResultTable correlation(RowSet rows, List<FieldRef> measures) {
        List<ResultColumn> header = new ArrayList<>();
        header.add(ResultColumn.dimension(MEASURE, ColumnKind.STRING));
        for (FieldRef m : measures) {
            header.add(ResultColumn.derived(m.name(), ColumnKind.NUMBER));
        }
        int k = measures.size();
        Double[][] matrix = new Double[k][k];
        for (int a = 0; a < k; a++) {
            for (int b = a; b < k; b++) {
                Double r = pearson(rows, measures.get(a), measures.get(b));
                if (a == b && r != null) {
                    r = 1.0;
                }
                matrix[a][b] = r;
                matrix[b][a] = r;
            }
        }
        List<ResultRow> out = new ArrayList<>();
        for (int a = 0; a < k; a++) {
            List<Object> cells = new ArrayList<>();
            cells.add(measures.get(a).name());
            for (int b = 0; b < k; b++) {
                cells.add(matrix[a][b]);
            }
            out.add(new ResultRow(cells, RowGroup.DETAIL));
        }
        return new ResultTable(header, out);
    }

    /**
     * Equal-width bins from the lower bound; the last bin includes the upper bound. Values outside explicit bounds
     * are not counted.
     */
    public ResultTable histogram(RowSet rows, FieldRef measure, HistogramSpec spec) {
        Objects.requireNonNull(spec, "spec");
        boolean byCount = spec.binCount() != null;
        if (byCount == (spec.binWidth() != null)) {
            throw new InvalidArgumentException("Histogram needs exactly one of bin count and bin width");
        }
        if (byCount && spec.binCount() <= 0) {
            throw new InvalidArgumentException("Bin count must be positive, got " + spec.binCount());
        }
        if (byCount && spec.binCount() > MAX_BINS) {
            throw new InvalidArgumentException("Bin count " + spec.binCount() + " exceeds the limit of " + MAX_BINS);
        }
        if (!byCount && !(spec.binWidth() > 0.0)) {
            throw new InvalidArgumentException("Bin width must be positive, got " + spec.binWidth());
        }
        if (spec.min() != null && spec.max() != null && spec.min() > spec.max()) {
            throw new InvalidArgumentException("Histogram minimum " + spec.min() + " exceeds maximum " + spec.max());
        }

        List<ResultColumn> header = new ArrayList<>();
        header.add(ResultColumn.dimension("bin", ColumnKind.NUMBER));
        for (String c : List.of("lower", "upper", "frequency", "percentage", "cumulative_frequency",
                "cumulative_percentage")) {
            header.add(ResultColumn.derived(c, ColumnKind.NUMBER));
        }

        Sample s = Sample.of(column(rows.getRows(), measure));
        Double lo = spec.min() != null ? spec.min() : s.min();
        Double hi = spec.max() != null ? spec.max() : s.max();
        if (lo == null || hi == null) {
            return new ResultTable(header, List.of());
        }
        int bins;
        double width;
        if (hi.equals(lo)) {
            bins = 1;
            width = byCount ? 0.0 : spec.binWidth();
        } else if (byCount) {
            bins = spec.binCount();
            width = (hi - lo) / bins;
        } else {
            width = spec.binWidth();
            double needed = Math.ceil((hi - lo) / width);
            if (!(needed <= MAX_BINS)) {
                throw new InvalidArgumentException("Bin width " + width + " over [" + lo + ", " + hi + "] needs "
                        + needed + " bins, the limit is " + MAX_BINS);
            }
            bins = Math.max(1, (int) needed);
        }

        long[] freq = new long[bins];
        long total = 0;
        for (double v : s.values()) {
            if (v < lo || v > hi) {
                continue;
            }
            int bin = width == 0.0 ? 0 : (int) Math.floor((v - lo) / width);
            freq[Math.min(bin, bins - 1)]++;
            total++;
        }

        List<ResultRow> out = new ArrayList<>(bins);
        long cumulative = 0;
        for (int i = 0; i < bins; i++) {
            cumulative += freq[i];
            double lower = lo + i * width;
            double upper = i == bins - 1 && byCount ? hi : lo + (i + 1) * width;
            List<Object> cells = new ArrayList<>();
            cells.add((long) (i + 1));
            cells.add(lower);
            cells.add(upper);
            cells.add(freq[i]);
            cells.add(total == 0 ? null : 100.0 * freq[i] / total);
            cells.add(cumulative);
            cells.add(total == 0 ? null : 100.0 * cumulative / total);
            out.add(new ResultRow(cells, RowGroup.DETAIL));
        }
        return new ResultTable(header, out);
    }

    /**
     * Rows whose measure lies outside {@code [q1 - k*IQR, q3 + k*IQR]} or whose absolute z-score exceeds the
     * threshold. Each returned row carries its score and whether it is a low or high outlier.
     */
    public ResultTable outliers(RowSet rows, FieldRef measure, OutlierMethod method, Double threshold) {
        Objects.requireNonNull(method, "method");
        double t = threshold == null ? method.defaultThreshold() : threshold;
        if (!(t > 0.0)) {
            throw new InvalidArgumentException("Outlier threshold must be positive, got " + threshold);
        }
        Sample s = Sample.of(column(rows.getRows(), measure));

        List<ResultColumn> header = new ArrayList<>();
        for (int i = 0; i < rows.getColumns().size(); i++) {
            header.add(ResultColumn.attribute(rows.column(i).name(), rows.column(i).kind()));
        }
        header.add(ResultColumn.derived(measure.name() + "_score", ColumnKind.NUMBER));
        header.add(ResultColumn.derived(measure.name() + "_outlier", ColumnKind.STRING));

        List<ResultRow> out = new ArrayList<>();
        if (s.isEmpty()) {
            return new ResultTable(header, out);
        }
        double lowFence;
        double highFence;
        Double mean = s.mean();
        Double stddev = s.stddev();
        if (method == OutlierMethod.IQR) {
            double q1 = s.percentile(0.25, percentileMethod);
            double q3 = s.percentile(0.75, percentileMethod);
            lowFence = q1 - t * (q3 - q1);
            highFence = q3 + t * (q3 - q1);
        } else {
            if (stddev == null || stddev == 0.0) {
                return new ResultTable(header, out);
            }
            lowFence = mean - t * stddev;
            highFence = mean + t * stddev;
        }

        for (List<Object> row : rows.getRows()) {
            Double v = CellValues.toDouble(row.get(measure.index()));
            if (v == null || (v >= lowFence && v <= highFence)) {
                continue;
            }
            double score = method == OutlierMethod.ZSCORE ? (v - mean) / stddev
                    : v < lowFence ? v - lowFence : v - highFence;
            List<Object> cells = new ArrayList<>(row);
            cells.add(score);
            cells.add(v < lowFence ? "low" : "high");
            out.add(new ResultRow(cells, RowGroup.DETAIL));
        }
        LOGGER.debug("Found {} {} outliers of {} among {} values", out.size(), method, measure.name(), s.count());
        return new ResultTable(header, out);
    }

    /**
     * Top-N (or bottom-N) with contribution analysis: share of the total, running sum and running percentage, and
     * the A/B/C class. Rows with a NULL measure are dropped; percentages always refer to the full set.
     */
    public ResultTable pareto(RowSet rows, List<FieldRef> labels, FieldRef measure, ParetoSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.limit() != null && spec.limit() <= 0) {
            throw new InvalidArgumentException("Limit must be positive, got " + spec.limit());
        }
        if (spec.classAThreshold() <= 0.0 || spec.classAThreshold() > spec.classBThreshold()
                || spec.classBThreshold() > 100.0) {
            throw new InvalidArgumentException("Pareto thresholds must satisfy 0 < A <= B <= 100, got A="
                    + spec.classAThreshold() + ", B=" + spec.classBThreshold());
        }

        List<Ranked> ranked = new ArrayList<>();
        for (List<Object> row : rows.getRows()) {
            Double v = CellValues.toDouble(row.get(measure.index()));
            if (v != null) {
                ranked.add(new Ranked(row, v));
            }
        }
        Comparator<Ranked> byValue = Comparator.comparingDouble(Ranked::value);
        ranked.sort(spec.bottom() ? byValue : byValue.reversed());

        // Summed in ranking order so the last running sum equals the total bit for bit.
        double total = 0;
        for (Ranked r : ranked) {
            total += r.value();
        }

        List<ResultColumn> header = new ArrayList<>();
        for (FieldRef l : labels) {
            header.add(ResultColumn.dimension(l.name(), l.kind()));
        }
        header.add(ResultColumn.measure(measure.name()));
        header.add(ResultColumn.derived("rank", ColumnKind.NUMBER));
        header.add(ResultColumn.derived("share_pct", ColumnKind.NUMBER));
        header.add(ResultColumn.derived("cumulative", ColumnKind.NUMBER));
        header.add(ResultColumn.derived("cumulative_pct", ColumnKind.NUMBER));
        header.add(ResultColumn.derived("pareto_class", ColumnKind.STRING));

        int limit = spec.limit() == null ? ranked.size() : Math.min(spec.limit(), ranked.size());
        List<ResultRow> out = new ArrayList<>(limit);
        double cumulative = 0;
        for (int i = 0; i < limit; i++) {
            List<Object> row = ranked.get(i).row();
            double v = ranked.get(i).value();
            cumulative += v;
            Double share = total == 0.0 ? null : 100.0 * v / total;
            Double cumulativePct = total == 0.0 ? null : 100.0 * (cumulative / total);
            String paretoClass = cumulativePct == null ? null
                    : cumulativePct <= spec.classAThreshold() ? "A"
                    : cumulativePct <= spec.classBThreshold() ? "B" : "C";
            List<Object> cells = new ArrayList<>();
            for (FieldRef l : labels) {
                cells.add(row.get(l.index()));
            }
            cells.add(v);
            cells.add((long) (i + 1));
            cells.add(share);
            cells.add(cumulative);
            cells.add(cumulativePct);
            cells.add(paretoClass);
            out.add(new ResultRow(cells, RowGroup.ranked(i + 1, paretoClass)));
        }
        return new ResultTable(header, out);
    }

    /**
     * Column label of a percentile: 0.25 is {@code p25}, 0.999 is {@code p99_9}.
     */
    static String percentileName(double q) {
        BigDecimal pct = BigDecimal.valueOf(q).multiply(BigDecimal.valueOf(100)).stripTrailingZeros();
        String plain = pct.scale() <= 0 ? pct.toBigInteger().toString() : pct.toPlainString();
        return "p" + plain.replace('.', '_');
    }

    private Double iqr(Sample s) {
        if (s.isEmpty()) {
            return null;
        }
        return s.percentile(0.75, percentileMethod) - s.percentile(0.25, percentileMethod);
    }

    private static Double pearson(RowSet rows, FieldRef x, FieldRef y) {
        List<double[]> pairs = new ArrayList<>();
        for (List<Object> row : rows.getRows()) {
            Double a = CellValues.toDouble(row.get(x.index()));
            Double b = CellValues.toDouble(row.get(y.index()));
            if (a != null && b != null) {
                pairs.add(new double[]{a, b});
            }
        }
        int n = pairs.size();
        if (n < 2) {
            return null;
        }
        double meanX = 0;
        double meanY = 0;
        for (double[] p : pairs) {
            meanX += p[0];
            meanY += p[1];
        }
        meanX /= n;
        meanY /= n;
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (double[] p : pairs) {
            sxy += (p[0] - meanX) * (p[1] - meanY);
            sxx += (p[0] - meanX) * (p[0] - meanX);
            syy += (p[1] - meanY) * (p[1] - meanY);
        }
        if (sxx == 0.0 || syy == 0.0) {
            return null;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    private Map<List<Object>, List<List<Object>>> partition(RowSet rows, List<FieldRef> groupBy) {
        Map<List<Object>, List<List<Object>>> groups = new TreeMap<>(CellValues.keyComparator(nullOrdering));
        for (List<Object> row : rows.getRows()) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (FieldRef g : groupBy) {
                key.add(CellValues.normalize(row.get(g.index())));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groupBy.isEmpty() && groups.isEmpty()) {
            groups.put(List.of(), List.of());
        }
        return groups;
    }

    private static List<Double> column(List<List<Object>> rows, FieldRef field) {
        List<Double> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(CellValues.toDouble(row.get(field.index())));
        }
        return values;
    }

    private static List<String> names(List<FieldRef> refs) {
        List<String> names = new ArrayList<>(refs.size());
        for (FieldRef r : refs) {
            names.add(r.name());
        }
        return names;
    }

    private record Ranked(List<Object> row, double value) {
    }
}
