package org.iceforge.olap.engine.window;

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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes one window function per call and appends it as an extra column to the input rows.
 * <p>
 * Partitions are independent. Within a partition rows are stably sorted by the order keys, so ties keep their input
 * order. The output lists partitions in key order, each in window order.
 */
public class WindowEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(WindowEngine.class);

    private final NullOrdering nullOrdering;
    private final Comparator<List<Object>> partitionComparator;

    public WindowEngine(NullOrdering nullOrdering) {
        this.nullOrdering = Objects.requireNonNull(nullOrdering);
        this.partitionComparator = CellValues.keyComparator(nullOrdering);
    }

    public ResultTable window(RowSet rows, List<FieldRef> partitionBy, List<SortKey> orderBy, WindowFunction function,
                              FieldRef valueField, WindowParams params, String outputName) {
        return window(ResultTable.of(rows), partitionBy, orderBy, function, valueField, params, outputName);
    }

    /**
     * Runs over an earlier result, e.g. grouped rows. Column roles and row grouping metadata are kept; ranking
     * functions add their rank to the existing grouping.
     */
    public ResultTable window(ResultTable table, List<FieldRef> partitionBy, List<SortKey> orderBy,
                              WindowFunction function, FieldRef valueField, WindowParams params, String outputName) {
        Objects.requireNonNull(function, "function");
        WindowParams p = params == null ? WindowParams.NONE : params;
        List<FieldRef> partitions = partitionBy == null ? List.of() : partitionBy;
        List<SortKey> order = orderBy == null ? List.of() : orderBy;
        validate(function, order, valueField, p);

        Map<List<Object>, List<ResultRow>> byPartition = new TreeMap<>(partitionComparator);
        for (ResultRow row : table.getRows()) {
            List<Object> key = new ArrayList<>(partitions.size());
            for (FieldRef f : partitions) {
                key.add(CellValues.normalize(row.get(f.index())));
            }
            byPartition.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        Comparator<ResultRow> rowOrder = Comparator.comparing(ResultRow::cells, rowComparator(order));
        List<ResultRow> out = new ArrayList<>(table.size());
        for (List<ResultRow> partition : byPartition.values()) {
            // List.sort is stable
            partition.sort(rowOrder);
            List<List<Object>> cellsInOrder = new ArrayList<>(partition.size());
            for (ResultRow row : partition) {
                cellsInOrder.add(row.cells());
            }
            Object[] computed = compute(function, cellsInOrder, order, valueField, p);
            for (int i = 0; i < partition.size(); i++) {
                ResultRow row = partition.get(i);
                List<Object> cells = new ArrayList<>(row.cells());
                cells.add(computed[i]);
                RowGroup tag = isRankValue(function) && computed[i] != null
                        ? row.group().withRank(((Number) computed[i]).longValue()) : row.group();
                out.add(new ResultRow(cells, tag));
            }
        }

        List<ResultColumn> header = new ArrayList<>(table.getColumns());
        String name = outputName != null && !outputName.isBlank() ? outputName : defaultName(function, valueField);
        header.add(ResultColumn.derived(name, outputKind(function, table, valueField)));
        LOGGER.debug("Window {} over {} partitions produced column '{}'", function.label(), byPartition.size(), name);
        return new ResultTable(header, out);
    }

    public static String defaultName(WindowFunction function, FieldRef valueField) {
        return valueField == null ? function.label() : valueField.name() + "_" + function.label();
    }

    private static void validate(WindowFunction function, List<SortKey> order, FieldRef valueField, WindowParams p) {
        if (function.requiresOrder() && order.isEmpty()) {
            throw new InvalidArgumentException(function.label() + " requires at least one order key");
        }
        if (function.requiresValue() && valueField == null) {
            throw new InvalidArgumentException(function.label() + " requires a value field");
        }
        switch (function) {
            case MOVING_AVG, MOVING_SUM -> {
                if (p.size() == null || p.size() <= 0) {
                    throw new InvalidArgumentException(function.label() + " requires a positive window size, got "
                            + p.size());
                }
            }
            case NTILE -> {
                if (p.buckets() == null || p.buckets() <= 0) {
                    throw new InvalidArgumentException("ntile requires a positive bucket count, got " + p.buckets());
                }
            }
            case LAG, LEAD -> {
                if (p.offset() != null && p.offset() < 0) {
                    throw new InvalidArgumentException(function.label() + " offset must not be negative, got "
                            + p.offset());
                }
            }
            default -> {
            }
        }
    }

    private Comparator<List<Object>> rowComparator(List<SortKey> order) {
        return (a, b) -> {
            for (SortKey k : order) {
                Object x = a.get(k.field().index());
                Object y = b.get(k.field().index());
                int c = CellValues.compare(x, y, nullOrdering);
                if (c != 0) {
                    // Direction flips values, NULL placement stays as configured.
                    return k.descending() && x != null && y != null ? -c : c;
                }
            }
            return 0;
        };
    }

    private Object[] compute(WindowFunction function, List<List<Object>> partition, List<SortKey> order,
                             FieldRef valueField, WindowParams p) {
        int n = partition.size();
        Object[] out = new Object[n];
        switch (function) {
            case ROW_NUMBER -> {
                for (int i = 0; i < n; i++) {
                    out[i] = (long) (i + 1);
                }
            }
            case RANK, DENSE_RANK, PERCENT_RANK -> {
                long rank = 0;
                long dense = 0;
                for (int i = 0; i < n; i++) {
                    if (i == 0 || !peers(partition.get(i - 1), partition.get(i), order)) {
                        rank = i + 1;
                        dense++;
                    }
                    out[i] = switch (function) {
                        case RANK -> rank;
                        case DENSE_RANK -> dense;
                        default -> n == 1 ? 0.0 : (double) (rank - 1) / (n - 1);
                    };
                }
            }
            case CUME_DIST -> {
                int i = 0;
                while (i < n) {
                    int j = i;
                    while (j + 1 < n && peers(partition.get(i), partition.get(j + 1), order)) {
                        j++;
                    }
                    double dist = (double) (j + 1) / n;
                    for (int k = i; k <= j; k++) {
                        out[k] = dist;
                    }
                    i = j + 1;
                }
            }
            case NTILE -> {
                int buckets = p.buckets();
                int base = n / buckets;
                int larger = n % buckets;
                for (int i = 0; i < n; i++) {
                    long tile = i < larger * (base + 1)
                            ? i / (base + 1) + 1
                            : (i - larger * (base + 1)) / base + larger + 1;
                    out[i] = tile;
                }
            }
            case LAG, LEAD -> {
                int offset = p.offset() == null ? 1 : p.offset();
                for (int i = 0; i < n; i++) {
                    int j = function == WindowFunction.LAG ? i - offset : i + offset;
                    out[i] = j >= 0 && j < n ? partition.get(j).get(valueField.index()) : p.defaultValue();
                }
            }
            case FIRST_VALUE, LAST_VALUE -> {
                Object v = n == 0 ? null
                        : partition.get(function == WindowFunction.FIRST_VALUE ? 0 : n - 1).get(valueField.index());
                for (int i = 0; i < n; i++) {
                    out[i] = v;
                }
            }
            default -> computeNumeric(function, values(partition, valueField), p, out);
        }
        return out;
    }

    private static void computeNumeric(WindowFunction function, Double[] v, WindowParams p, Object[] out) {
        int n = v.length;
        switch (function) {
            case RUNNING_TOTAL, RUNNING_AVG, RUNNING_COUNT -> {
                double sum = 0;
                long count = 0;
                for (int i = 0; i < n; i++) {
                    if (v[i] != null) {
                        sum += v[i];
                        count++;
                    }
                    out[i] = switch (function) {
                        case RUNNING_COUNT -> count;
                        case RUNNING_TOTAL -> count == 0 ? null : sum;
                        default -> count == 0 ? null : sum / count;
                    };
                }
            }
            case RUNNING_MIN, RUNNING_MAX -> {
                Double best = null;
                for (int i = 0; i < n; i++) {
                    if (v[i] != null && (best == null
                            || (function == WindowFunction.RUNNING_MIN ? v[i] < best : v[i] > best))) {
                        best = v[i];
                    }
                    out[i] = best;
                }
            }
            case MOVING_AVG, MOVING_SUM -> {
                int size = p.size();
                for (int i = 0; i < n; i++) {
                    double sum = 0;
                    int count = 0;
                    for (int j = Math.max(0, i - size + 1); j <= i; j++) {
                        if (v[j] != null) {
                            sum += v[j];
                            count++;
                        }
                    }
                    out[i] = count == 0 ? null : function == WindowFunction.MOVING_SUM ? sum : sum / count;
                }
            }
            case PERCENT_OF_TOTAL, DIFFERENCE_FROM_AVERAGE -> {
                double sum = 0;
                int count = 0;
                for (Double d : v) {
                    if (d != null) {
                        sum += d;
                        count++;
                    }
                }
                for (int i = 0; i < n; i++) {
                    if (v[i] == null) {
                        out[i] = null;
                    } else if (function == WindowFunction.PERCENT_OF_TOTAL) {
                        out[i] = sum == 0.0 ? null : v[i] / sum;
                    } else {
                        out[i] = v[i] - sum / count;
                    }
                }
            }
            case DIFFERENCE_FROM_PREVIOUS -> {
                // the first row of a partition has no predecessor and is measured against 0
                for (int i = 0; i < n; i++) {
                    Double prev = i == 0 ? Double.valueOf(0.0) : v[i - 1];
                    out[i] = v[i] == null || prev == null ? null : v[i] - prev;
                }
            }
            case PERCENT_CHANGE -> {
                for (int i = 0; i < n; i++) {
                    Double prev = i == 0 ? null : v[i - 1];
                    out[i] = v[i] == null || prev == null || prev == 0.0 ? null : (v[i] - prev) / prev;
                }
            }
            case DIFFERENCE_FROM_FIRST -> {
                Double first = n == 0 ? null : v[0];
                for (int i = 0; i < n; i++) {
                    out[i] = v[i] == null || first == null ? null : v[i] - first;
                }
            }
            default -> throw new IllegalStateException("Unhandled window function " + function);
        }
    }

    private static Double[] values(List<List<Object>> partition, FieldRef valueField) {
        Double[] v = new Double[partition.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = CellValues.toDouble(partition.get(i).get(valueField.index()));
        }
        return v;
    }

    private boolean peers(List<Object> a, List<Object> b, List<SortKey> order) {
        for (SortKey k : order) {
            if (CellValues.compare(a.get(k.field().index()), b.get(k.field().index()), nullOrdering) != 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isRankValue(WindowFunction function) {
        return function == WindowFunction.RANK || function == WindowFunction.DENSE_RANK
                || function == WindowFunction.ROW_NUMBER;
    }

    private static ColumnKind outputKind(WindowFunction function, ResultTable table, FieldRef valueField) {
        return switch (function) {
            case LAG, LEAD, FIRST_VALUE, LAST_VALUE -> table.getColumns().get(valueField.index()).kind();
            default -> ColumnKind.NUMBER;
        };
    }
}
