package org.iceforge.olap.data;

import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.error.UnknownFieldException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Materialized rectangular input handed over by the row source: ordered, kinded columns and positionally aligned
 * rows. Immutable once built, so it can be shared by concurrent requests.
 */
public final class RowSet {

    private final List<Column> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> index;

    private RowSet(List<Column> columns, List<List<Object>> rows, Map<String, Integer> index) {
        this.columns = columns;
        this.rows = rows;
        this.index = index;
    }

    /**
     * Validates and copies the given rows.
     *
     * @throws MalformedInputException on duplicate column names, ragged rows or values that do not fit the kind
     *                                 declared for their column
     */
    public static RowSet of(List<Column> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (index.put(columns.get(i).name(), i) != null) {
                throw new MalformedInputException("Duplicate column name: " + columns.get(i).name());
            }
        }

        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            if (row == null || row.size() != columns.size()) {
                throw new MalformedInputException("Row " + r + " has " + (row == null ? 0 : row.size())
                        + " values, expected " + columns.size());
            }
            for (int c = 0; c < columns.size(); c++) {
                Object value = row.get(c);
                Column column = columns.get(c);
                if (!column.kind().accepts(value)) {
                    throw new MalformedInputException("Row " + r + ", column '" + column.name() + "': value '"
                            + value + "' (" + value.getClass().getSimpleName() + ") is not a " + column.kind());
                }
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new RowSet(List.copyOf(columns), Collections.unmodifiableList(copy), index);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public Column column(int i) {
        return columns.get(i);
    }

    public int indexOf(String name) {
        Integer i = index.get(name);
        return i == null ? -1 : i;
    }

    public int requireIndex(String name) {
        int i = indexOf(name);
        if (i < 0) {
            throw new UnknownFieldException("Input has no column '" + name + "'. Columns: " + index.keySet());
        }
        return i;
    }

    public RowSet filter(Predicate<List<Object>> predicate) {
        List<List<Object>> kept = new ArrayList<>();
        for (List<Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new RowSet(columns, Collections.unmodifiableList(kept), index);
    }

    @Override
    public String toString() {
        return "RowSet[columns=" + columns + ", rows=" + rows.size() + "]";
    }

    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        public Builder column(String name, ColumnKind kind) {
            columns.add(new Column(name, kind));
            return this;
        }

        public Builder row(Object... values) {
            rows.add(Arrays.asList(values));
            return this;
        }

        public RowSet build() {
            return RowSet.of(columns, rows);
        }
    }
}
