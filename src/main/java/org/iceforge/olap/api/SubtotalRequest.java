package org.iceforge.olap.api;

import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

/**
 * ROLLUP and CUBE request. For a rollup the dimension order is the peel order, finest last.
 */
public class SubtotalRequest extends AnalyticsRequest {

    private List<String> dimensions = new ArrayList<>();

    private String hierarchy;

    private String hierarchyLevel;

    @NotEmpty
    private List<String> measures;

    /**
     * Adds {@code <measure>_pct_total}: each row as a percentage of the grand total.
     */
    private boolean percentOfTotal;

    public List<String> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<String> dimensions) {
        this.dimensions = dimensions;
    }

    public String getHierarchy() {
        return hierarchy;
    }

    public void setHierarchy(String hierarchy) {
        this.hierarchy = hierarchy;
    }

    public String getHierarchyLevel() {
        return hierarchyLevel;
    }

    public void setHierarchyLevel(String hierarchyLevel) {
        this.hierarchyLevel = hierarchyLevel;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public boolean isPercentOfTotal() {
        return percentOfTotal;
    }

    public void setPercentOfTotal(boolean percentOfTotal) {
        this.percentOfTotal = percentOfTotal;
    }
}
