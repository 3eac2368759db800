package org.iceforge.olap.semantic;

import org.iceforge.olap.data.Column;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.error.AmbiguousJoinException;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.error.UnknownFieldException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps logical dimension and measure names to column positions of the flat, already-joined input. Touches names
 * only, never row data.
 */
@Component
public class FieldResolver {

    public ResolvedQuery resolve(Dataset ds, List<Column> columns, List<String> dimensions, List<String> measures) {
        Objects.requireNonNull(ds);
        Objects.requireNonNull(columns);
        List<String> dims = dimensions == null ? List.of() : dimensions;
        List<String> meas = measures == null ? List.of() : measures;

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            index.putIfAbsent(columns.get(i).name(), i);
        }
        JoinPaths paths = new JoinPaths(ds);

        Set<String> seen = new HashSet<>();
        List<FieldRef> dimRefs = new ArrayList<>(dims.size());
        for (String name : dims) {
            if (!seen.add(name)) {
                throw new InvalidArgumentException("Field '" + name + "' requested more than once");
            }
            Dimension dim = ds.dimension(name).orElseThrow(() -> new UnknownFieldException(
                    "Unknown dimension '" + name + "' in dataset '" + ds.getName() + "'. Available: "
                            + ds.getDimensions().keySet()));
            paths.requireSinglePath(name, dim.table());
            int i = locate(ds, index, name, dim.table(), dim.column());
            dimRefs.add(new FieldRef(name, i, columns.get(i).kind()));
        }

        List<MeasureRef> measureRefs = new ArrayList<>(meas.size());
        for (String name : meas) {
            if (!seen.add(name)) {
                throw new InvalidArgumentException("Field '" + name + "' requested more than once");
            }
            Measure m = ds.measure(name).orElseThrow(() -> new UnknownFieldException(
                    "Unknown measure '" + name + "' in dataset '" + ds.getName() + "'. Available: "
                            + ds.getMeasures().keySet()));
            paths.requireSinglePath(name, m.table());
            int i = locate(ds, index, name, m.table(), m.column());
            requireNumeric(m, columns.get(i));
            measureRefs.add(new MeasureRef(name, i, m.aggregation()));
        }
        return new ResolvedQuery(ds, dimRefs, measureRefs);
    }

    /**
     * Resolves a single name that may be a dimension or a measure; measures resolve to their raw input column.
     */
    public FieldRef resolveField(Dataset ds, List<Column> columns, String name) {
        if (ds.dimension(name).isPresent()) {
            return resolve(ds, columns, List.of(name), List.of()).dimensions().get(0);
        }
        if (ds.measure(name).isPresent()) {
            MeasureRef m = resolve(ds, columns, List.of(), List.of(name)).measures().get(0);
            return new FieldRef(name, m.index(), columns.get(m.index()).kind());
        }
        throw new UnknownFieldException("Unknown field '" + name + "' in dataset '" + ds.getName()
                + "'. Dimensions: " + ds.getDimensions().keySet() + ", measures: " + ds.getMeasures().keySet());
    }

    /**
     * Dimension names a hierarchy stands for, coarse to fine, optionally cut after {@code deepestLevel}.
     */
    public List<String> expandHierarchy(Dataset ds, String hierarchy, String deepestLevel) {
        Hierarchy h = ds.hierarchy(hierarchy).orElseThrow(() -> new UnknownFieldException(
                "Unknown hierarchy '" + hierarchy + "' in dataset '" + ds.getName() + "'. Available: "
                        + ds.getHierarchies().keySet()));
        if (deepestLevel == null || deepestLevel.isBlank()) {
            return h.levels();
        }
        if (!h.levels().contains(deepestLevel)) {
            throw new InvalidArgumentException("Hierarchy '" + hierarchy + "' has no level '" + deepestLevel
                    + "'. Levels: " + h.levels());
        }
        return h.levelsThrough(deepestLevel);
    }

    /**
     * Input columns are looked up by logical name first (row sources usually alias them), then by the declared
     * column expression, then by its table-qualified form.
     */
    private int locate(Dataset ds, Map<String, Integer> index, String name, String table, String column) {
        for (String candidate : List.of(name, column, table + "." + column)) {
            Integer i = index.get(candidate);
            if (i != null) {
                return i;
            }
        }
        throw new UnknownFieldException("Field '" + name + "' of dataset '" + ds.getName() + "' (column '"
                + column + "') is not present in the input. Columns: " + index.keySet());
    }

    private void requireNumeric(Measure m, Column column) {
        boolean numericFunction = m.aggregation() == AggregationFunction.SUM
                || m.aggregation() == AggregationFunction.AVG;
        if (numericFunction && column.kind() != ColumnKind.NUMBER && column.kind() != ColumnKind.NULL) {
            throw new MalformedInputException("Measure '" + m.name() + "' aggregates with "
                    + m.aggregation().label() + " but input column '" + column.name() + "' is " + column.kind());
        }
    }

    /**
     * Counts join paths from the base table through the dataset's own joins. The join graph is a DAG, which the
     * compiler guarantees, so the memoized count terminates.
     */
    private static final class JoinPaths {

        private final Dataset ds;
        private final Map<String, List<String>> parents = new HashMap<>();
        private final Map<String, Long> memo = new HashMap<>();

        JoinPaths(Dataset ds) {
            this.ds = ds;
            for (Join j : ds.getJoins()) {
                parents.computeIfAbsent(j.right(), k -> new ArrayList<>()).add(j.left());
            }
        }

        void requireSinglePath(String field, String table) {
            long count = count(table, new HashSet<>());
            if (count == 0) {
                throw new AmbiguousJoinException("Field '" + field + "' lives on table '" + table
                        + "' which dataset '" + ds.getName() + "' does not join from '" + ds.getBaseTable() + "'");
            }
            if (count > 1) {
                throw new AmbiguousJoinException("Field '" + field + "' lives on table '" + table
                        + "' which dataset '" + ds.getName() + "' reaches through " + count + " join paths");
            }
        }

        private long count(String table, Set<String> visiting) {
            if (table.equals(ds.getBaseTable())) {
                return 1;
            }
            Long cached = memo.get(table);
            if (cached != null) {
                return cached;
            }
            if (!visiting.add(table)) {
                return 0;
            }
            long total = 0;
            for (String parent : parents.getOrDefault(table, List.of())) {
                total += count(parent, visiting);
            }
            visiting.remove(table);
            memo.put(table, total);
            return total;
        }
    }
}
