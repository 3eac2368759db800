package org.iceforge.olap.model;

public class DimensionDef {
    private String column; // physical column expression, defaults to the logical name
    private String table;  // owning table, defaults to the dataset base table
    private String kind = "categorical"; // categorical | numeric | temporal
    private String grain; // temporal only, e.g. month
    private String description;

    public String getColumn() {
        return column;
    }

    public void setColumn(String column) {
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getGrain() {
        return grain;
    }

    public void setGrain(String grain) {
        this.grain = grain;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
