package org.iceforge.olap.data;

import org.iceforge.olap.error.UnknownFieldException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured engine output: tagged headers, typed rows and per-row grouping metadata. It carries plain Java values
 * and imposes no wire format.
 */
public final class ResultTable {

    private final List<ResultColumn> columns;
    private final List<ResultRow> rows;
    private final Map<String, Integer> index;

    public ResultTable(List<ResultColumn> columns, List<ResultRow> rows) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        this.index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            index.putIfAbsent(this.columns.get(i).name(), i);
        }
        for (ResultRow row : this.rows) {
            if (row.cells().size() != this.columns.size()) {
                throw new IllegalStateException("Row width " + row.cells().size()
                        + " does not match header width " + this.columns.size());
            }
        }
    }

    /**
     * Wraps raw input rows; every column becomes an {@link ColumnRole#ATTRIBUTE} and every row a detail row.
     */
    public static ResultTable of(RowSet rows) {
        List<ResultColumn> header = new ArrayList<>(rows.getColumns().size());
        for (Column c : rows.getColumns()) {
            header.add(ResultColumn.attribute(c.name(), c.kind()));
        }
        List<ResultRow> data = new ArrayList<>(rows.size());
        for (List<Object> row : rows.getRows()) {
            data.add(new ResultRow(row, RowGroup.DETAIL));
        }
        return new ResultTable(header, data);
    }

    public List<ResultColumn> getColumns() {
        return columns;
    }

    public List<ResultRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public int indexOf(String column) {
        Integer i = index.get(column);
        return i == null ? -1 : i;
    }

    public int requireIndex(String column) {
        int i = indexOf(column);
        if (i < 0) {
            throw new UnknownFieldException("Result has no column '" + column + "'. Columns: " + columnNames());
        }
        return i;
    }

    public Object value(int row, String column) {
        return rows.get(row).get(requireIndex(column));
    }

    public List<Object> column(String column) {
        int i = requireIndex(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            values.add(row.get(i));
        }
        return values;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ResultColumn c : columns) {
            names.add(c.name());
        }
        return names;
    }

    /**
     * Re-exposes this result as engine input so operations can be chained, e.g. a window over grouped rows.
     */
    public RowSet toRowSet() {
        List<Column> header = new ArrayList<>(columns.size());
        for (ResultColumn c : columns) {
            header.add(new Column(c.name(), c.kind()));
        }
        List<List<Object>> data = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            data.add(row.cells());
        }
        return RowSet.of(header, data);
    }

    /**
     * First {@code n} rows, or this table when it is not longer than that.
     */
    public ResultTable head(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Row limit must not be negative, got " + n);
        }
        return n >= rows.size() ? this : new ResultTable(columns, rows.subList(0, n));
    }

    @Override
    public String toString() {
        return "ResultTable[columns=" + columnNames() + ", rows=" + rows.size() + "]";
    }
}
