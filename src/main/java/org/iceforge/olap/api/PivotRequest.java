package org.iceforge.olap.api;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.util.ArrayList;
import java.util.List;

public class PivotRequest extends AnalyticsRequest {

    private List<String> rows = new ArrayList<>();

    @NotEmpty
    private List<String> columns;

    @NotEmpty
    private List<String> measures;

    private boolean includeTotals = true;

    /**
     * row | column | grand_total; cells become fractions of that total.
     */
    @Pattern(regexp = "(?i)row|column|grand_total|total")
    private String percentageOf;

    public List<String> getRows() {
        return rows;
    }

    public void setRows(List<String> rows) {
        this.rows = rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public boolean isIncludeTotals() {
        return includeTotals;
    }

    public void setIncludeTotals(boolean includeTotals) {
        this.includeTotals = includeTotals;
    }

    public String getPercentageOf() {
        return percentageOf;
    }

    public void setPercentageOf(String percentageOf) {
        this.percentageOf = percentageOf;
    }
}
