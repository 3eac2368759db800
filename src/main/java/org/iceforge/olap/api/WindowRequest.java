package org.iceforge.olap.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.ArrayList;
import java.util.List;

/**
 * One or more window calculations over the same rows, applied in order. Each adds a column; the rows come out in
 * the partition and window order of the last calculation.
 */
public class WindowRequest extends AnalyticsRequest {

    @Valid
    @NotEmpty
    private List<WindowCalculation> calculations;

    /**
     * When set, rows are first aggregated by these dimensions over {@link #measures} and the windows run on the
     * aggregated rows.
     */
    private List<String> groupBy = new ArrayList<>();

    private List<String> measures = new ArrayList<>();

    /**
     * Keep only the first rows of the final output.
     */
    @Positive
    private Integer limit;

    public List<WindowCalculation> getCalculations() {
        return calculations;
    }

    public void setCalculations(List<WindowCalculation> calculations) {
        this.calculations = calculations;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
