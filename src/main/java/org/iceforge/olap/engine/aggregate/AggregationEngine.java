package org.iceforge.olap.engine.aggregate;

import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.ColumnRole;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.data.ResultColumn;
import org.iceforge.olap.data.ResultRow;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowGroup;
import org.iceforge.olap.data.RowKind;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.semantic.AggregationFunction;
import org.iceforge.olap.semantic.FieldRef;
import org.iceforge.olap.semantic.MeasureRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Grouped aggregation, pivoting and multi-level subtotals over in-memory rows.
 * <p>
 * Group keys compare with {@link CellValues#keyComparator(NullOrdering)}, so NULL is a group value of its own and
 * sorts according to the configured {@link NullOrdering}.
 */
public class AggregationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationEngine.class);

    static final String PCT_TOTAL_SUFFIX = "_pct_total";

    static final String KEY_SEPARATOR = "_";
    static final String TOTAL_PREFIX = "total_";

    private final NullOrdering nullOrdering;
    private final Comparator<List<Object>> keyComparator;

    public AggregationEngine(NullOrdering nullOrdering) {
        this.nullOrdering = Objects.requireNonNull(nullOrdering);
        this.keyComparator = CellValues.keyComparator(nullOrdering);
    }

    public NullOrdering getNullOrdering() {
        return nullOrdering;
    }

    /**
     * One output row per distinct group key in ascending key order. With no group-by dimensions the result is a
     * single grand-total row, even over empty input.
     */
    public ResultTable aggregate(RowSet rows, List<FieldRef> groupBy, List<MeasureRef> measures) {
        List<ResultRow> out = new ArrayList<>();
        for (Map.Entry<List<Object>, Accumulator[]> e : group(rows, groupBy, measures).entrySet()) {
            out.add(new ResultRow(row(e.getKey(), e.getValue()), RowGroup.DETAIL));
        }
        return new ResultTable(header(rows, groupBy, measures), out);
    }

    /**
     * ROLLUP: levels n down to 0, each dropping the finest remaining dimension. Collapsed dimensions are NULL.
     */
    public ResultTable rollup(RowSet rows, List<FieldRef> dimensions, List<MeasureRef> measures) {
        List<List<Integer>> sets = new ArrayList<>();
        for (int level = dimensions.size(); level >= 0; level--) {
            List<Integer> set = new ArrayList<>();
            for (int i = 0; i < level; i++) {
                set.add(i);
            }
            sets.add(set);
        }
        return groupings(rows, dimensions, measures, sets, false);
    }

    /**
     * CUBE: every subset of the dimensions, ordered by the GROUPING() bit pattern with the first dimension as most
     * significant bit, so full detail comes first and the grand total last.
     */
    public ResultTable cube(RowSet rows, List<FieldRef> dimensions, List<MeasureRef> measures) {
        int n = dimensions.size();
        if (n > 16) {
            throw new InvalidArgumentException("CUBE over " + n + " dimensions would produce 2^" + n + " groupings");
        }
        List<List<Integer>> sets = new ArrayList<>();
        for (int groupingId = 0; groupingId < (1 << n); groupingId++) {
            List<Integer> set = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if ((groupingId & (1 << (n - 1 - i))) == 0) {
                    set.add(i);
                }
            }
            sets.add(set);
        }
        return groupings(rows, dimensions, measures, sets, false);
    }

    /**
     * GROUPING SETS in the caller's order; each row carries the index of the set that produced it.
     */
    public ResultTable groupingSets(RowSet rows, List<FieldRef> dimensions, List<List<String>> groupingSets,
                                    List<MeasureRef> measures) {
        if (groupingSets == null || groupingSets.isEmpty()) {
            throw new InvalidArgumentException("At least one grouping set is required");
        }
        List<String> names = names(dimensions);
        List<List<Integer>> sets = new ArrayList<>();
        for (List<String> set : groupingSets) {
            List<Integer> indices = new ArrayList<>();
            for (String name : set) {
                int i = names.indexOf(name);
                if (i < 0) {
                    throw new InvalidArgumentException("Grouping set " + set + " uses '" + name
                            + "' which is not one of the dimensions " + names);
                }
                if (indices.contains(i)) {
                    throw new InvalidArgumentException("Grouping set " + set + " repeats '" + name + "'");
                }
                indices.add(i);
            }
            indices.sort(Comparator.naturalOrder());
            sets.add(indices);
        }
        return groupings(rows, dimensions, measures, sets, true);
    }

    /**
     * Appends {@code <measure>_pct_total}, each row's value as a percentage (0-100) of the grand total row, to
     * the output of {@link #rollup}, {@link #cube} or {@link #groupingSets} with an empty set. The grand total row
     * itself gets 100; a zero or NULL total gives NULL.
     */
    public ResultTable withPercentOfTotal(ResultTable grouped, List<MeasureRef> measures) {
        ResultRow grandTotal = null;
        for (ResultRow r : grouped.getRows()) {
            if (r.group().kind() == RowKind.GRAND_TOTAL) {
                grandTotal = r;
                break;
            }
        }
        if (grandTotal == null) {
            throw new InvalidArgumentException("Percent of total needs a grand total row; include the empty "
                    + "grouping set");
        }
        int[] columns = new int[measures.size()];
        Double[] totals = new Double[measures.size()];
        List<ResultColumn> header = new ArrayList<>(grouped.getColumns());
        for (int m = 0; m < columns.length; m++) {
            String name = measures.get(m).name();
            columns[m] = grouped.requireIndex(name);
            if (grouped.getColumns().get(columns[m]).kind() != ColumnKind.NUMBER) {
                throw new InvalidArgumentException("Measure '" + name + "' is not numeric, it has no percent of total");
            }
            totals[m] = CellValues.toDouble(grandTotal.get(columns[m]));
            header.add(ResultColumn.derived(name + PCT_TOTAL_SUFFIX, ColumnKind.NUMBER));
        }
        List<ResultRow> out = new ArrayList<>(grouped.size());
        for (ResultRow r : grouped.getRows()) {
            List<Object> cells = new ArrayList<>(r.cells());
            for (int m = 0; m < columns.length; m++) {
                Double v = CellValues.toDouble(r.get(columns[m]));
                cells.add(v == null || totals[m] == null || totals[m] == 0.0 ? null : 100.0 * v / totals[m]);
            }
            out.add(new ResultRow(cells, r.group()));
        }
        return new ResultTable(header, out);
    }

    /**
     * Cross-tabulates measures: one row per observed row key, one column per observed column key and measure.
     * Missing combinations stay NULL.
     */
    public ResultTable pivot(RowSet rows, List<FieldRef> rowDims, List<FieldRef> columnDims,
                             List<MeasureRef> measures, PivotOptions options) {
        PivotOptions opts = options == null ? PivotOptions.DEFAULTS : options;
        if (columnDims.isEmpty()) {
            throw new InvalidArgumentException("Pivot needs at least one column dimension");
        }
        Set<String> overlap = new HashSet<>(names(rowDims));
        overlap.retainAll(names(columnDims));
        if (!overlap.isEmpty()) {
            throw new InvalidArgumentException("Pivot row and column dimensions overlap: " + overlap);
        }

        Map<List<Object>, Map<List<Object>, Accumulator[]>> cells = new TreeMap<>(keyComparator);
        Map<List<Object>, Accumulator[]> rowTotals = new TreeMap<>(keyComparator);
        Map<List<Object>, Accumulator[]> columnTotals = new TreeMap<>(keyComparator);
        Accumulator[] grand = accumulators(measures);
        TreeSet<List<Object>> columnKeys = new TreeSet<>(keyComparator);

        for (List<Object> row : rows.getRows()) {
            List<Object> rk = key(row, rowDims);
            List<Object> ck = key(row, columnDims);
            columnKeys.add(ck);
            feed(cells.computeIfAbsent(rk, k -> new TreeMap<>(keyComparator))
                    .computeIfAbsent(ck, k -> accumulators(measures)), row, measures);
            feed(rowTotals.computeIfAbsent(rk, k -> accumulators(measures)), row, measures);
            feed(columnTotals.computeIfAbsent(ck, k -> accumulators(measures)), row, measures);
            feed(grand, row, measures);
        }

        List<ResultColumn> header = new ArrayList<>();
        for (FieldRef d : rowDims) {
            header.add(ResultColumn.dimension(d.name(), d.kind()));
        }
        for (List<Object> ck : columnKeys) {
            for (MeasureRef m : measures) {
                header.add(measureColumn(columnLabel(ck) + KEY_SEPARATOR + m.name(), rows, m, opts));
            }
        }
        if (opts.includeTotals()) {
            for (MeasureRef m : measures) {
                header.add(measureColumn(TOTAL_PREFIX + m.name(), rows, m, opts));
            }
        }

        List<ResultRow> out = new ArrayList<>();
        for (Map.Entry<List<Object>, Map<List<Object>, Accumulator[]>> e : cells.entrySet()) {
            Accumulator[] rowTotal = rowTotals.get(e.getKey());
            List<Object> values = new ArrayList<>(e.getKey());
            for (List<Object> ck : columnKeys) {
                Accumulator[] acc = e.getValue().get(ck);
                for (int m = 0; m < measures.size(); m++) {
                    Object raw = acc == null ? null : acc[m].result();
                    values.add(share(raw, opts.percentageOf(), rowTotal[m], columnTotals.get(ck)[m], grand[m]));
                }
            }
            if (opts.includeTotals()) {
                for (int m = 0; m < measures.size(); m++) {
                    values.add(share(rowTotal[m].result(), opts.percentageOf(), rowTotal[m], grand[m], grand[m]));
                }
            }
            out.add(new ResultRow(values, RowGroup.DETAIL));
        }

        if (opts.includeTotals()) {
            List<Object> values = new ArrayList<>();
            for (int i = 0; i < rowDims.size(); i++) {
                values.add(null);
            }
            for (List<Object> ck : columnKeys) {
                Accumulator[] colTotal = columnTotals.get(ck);
                for (int m = 0; m < measures.size(); m++) {
                    values.add(share(colTotal[m].result(), opts.percentageOf(), grand[m], colTotal[m], grand[m]));
                }
            }
            for (int m = 0; m < measures.size(); m++) {
                values.add(share(grand[m].result(), opts.percentageOf(), grand[m], grand[m], grand[m]));
            }
            out.add(new ResultRow(values, RowGroup.total(RowKind.GRAND_TOTAL)));
        }
        LOGGER.debug("Pivot {} x {} produced {} rows and {} value columns", names(rowDims), names(columnDims),
                out.size(), columnKeys.size() * measures.size());
        return new ResultTable(header, out);
    }

    private ResultTable groupings(RowSet rows, List<FieldRef> dimensions, List<MeasureRef> measures,
                                  List<List<Integer>> sets, boolean tagSetIndex) {
        List<String> names = names(dimensions);
        List<ResultRow> out = new ArrayList<>();
        for (int s = 0; s < sets.size(); s++) {
            List<Integer> set = sets.get(s);
            List<FieldRef> grouped = new ArrayList<>();
            List<String> groupedNames = new ArrayList<>();
            List<String> collapsed = new ArrayList<>();
            for (int i = 0; i < dimensions.size(); i++) {
                if (set.contains(i)) {
                    grouped.add(dimensions.get(i));
                    groupedNames.add(names.get(i));
                } else {
                    collapsed.add(names.get(i));
                }
            }
            RowGroup tag = RowGroup.grouping(groupedNames, collapsed, tagSetIndex ? s : null);
            for (Map.Entry<List<Object>, Accumulator[]> e : group(rows, grouped, measures).entrySet()) {
                List<Object> values = new ArrayList<>(dimensions.size() + measures.size());
                int k = 0;
                for (int i = 0; i < dimensions.size(); i++) {
                    values.add(set.contains(i) ? e.getKey().get(k++) : null);
                }
                for (Accumulator a : e.getValue()) {
                    values.add(a.result());
                }
                out.add(new ResultRow(values, tag));
            }
        }
        LOGGER.debug("Computed {} groupings over {} producing {} rows", sets.size(), names, out.size());
        return new ResultTable(header(rows, dimensions, measures), out);
    }

    private TreeMap<List<Object>, Accumulator[]> group(RowSet rows, List<FieldRef> groupBy,
                                                       List<MeasureRef> measures) {
        TreeMap<List<Object>, Accumulator[]> groups = new TreeMap<>(keyComparator);
        for (List<Object> row : rows.getRows()) {
            feed(groups.computeIfAbsent(key(row, groupBy), k -> accumulators(measures)), row, measures);
        }
        if (groupBy.isEmpty() && groups.isEmpty()) {
            groups.put(List.of(), accumulators(measures));
        }
        return groups;
    }

    private static List<Object> key(List<Object> row, List<FieldRef> dims) {
        List<Object> key = new ArrayList<>(dims.size());
        for (FieldRef d : dims) {
            key.add(CellValues.normalize(row.get(d.index())));
        }
        return key;
    }

    private static Accumulator[] accumulators(List<MeasureRef> measures) {
        Accumulator[] acc = new Accumulator[measures.size()];
        for (int i = 0; i < acc.length; i++) {
            acc[i] = new Accumulator(measures.get(i).function());
        }
        return acc;
    }

    private static void feed(Accumulator[] acc, List<Object> row, List<MeasureRef> measures) {
        for (int i = 0; i < acc.length; i++) {
            acc[i].add(row.get(measures.get(i).index()));
        }
    }

    private static List<Object> row(List<Object> key, Accumulator[] acc) {
        List<Object> values = new ArrayList<>(key.size() + acc.length);
        values.addAll(key);
        for (Accumulator a : acc) {
            values.add(a.result());
        }
        return values;
    }

    private static List<ResultColumn> header(RowSet rows, List<FieldRef> dims, List<MeasureRef> measures) {
        List<ResultColumn> header = new ArrayList<>();
        for (FieldRef d : dims) {
            header.add(ResultColumn.dimension(d.name(), d.kind()));
        }
        for (MeasureRef m : measures) {
            header.add(new ResultColumn(m.name(), ColumnRole.MEASURE, measureKind(rows, m)));
        }
        return header;
    }

    /**
     * MIN and MAX keep the kind of their input, every other function yields a number.
     */
    static ColumnKind measureKind(RowSet rows, MeasureRef m) {
        if (m.function() == AggregationFunction.MIN || m.function() == AggregationFunction.MAX) {
            ColumnKind input = rows.column(m.index()).kind();
            return input == ColumnKind.NULL ? ColumnKind.NUMBER : input;
        }
        return ColumnKind.NUMBER;
    }

    private static ResultColumn measureColumn(String name, RowSet rows, MeasureRef m, PivotOptions opts) {
        if (opts.percentageOf() != null) {
            return ResultColumn.derived(name, ColumnKind.NUMBER);
        }
        return new ResultColumn(name, ColumnRole.MEASURE, measureKind(rows, m));
    }

    private static Object share(Object raw, PercentageOf mode, Accumulator rowTotal, Accumulator columnTotal,
                                Accumulator grandTotal) {
        if (mode == null || raw == null) {
            return raw;
        }
        Object denominator = switch (mode) {
            case ROW -> rowTotal.result();
            case COLUMN -> columnTotal.result();
            case GRAND_TOTAL -> grandTotal.result();
        };
        if (!(raw instanceof Number) || !(denominator instanceof Number d) || d.doubleValue() == 0.0) {
            return null;
        }
        return ((Number) raw).doubleValue() / d.doubleValue();
    }

    static String columnLabel(List<Object> columnKey) {
        return columnKey.stream().map(String::valueOf).collect(Collectors.joining(KEY_SEPARATOR));
    }

    private static List<String> names(List<FieldRef> refs) {
        List<String> names = new ArrayList<>(refs.size());
        for (FieldRef r : refs) {
            names.add(r.name());
        }
        return names;
    }
}
