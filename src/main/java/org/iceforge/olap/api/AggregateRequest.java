package org.iceforge.olap.api;

import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class AggregateRequest extends AnalyticsRequest {

    /**
     * Dimensions to group by; empty for a single grand-total row.
     */
    private List<String> groupBy = new ArrayList<>();

    /**
     * Alternative to {@link #groupBy}: group by the levels of this hierarchy.
     */
    private String hierarchy;

    /**
     * Deepest hierarchy level to include, the whole hierarchy when absent.
     */
    private String hierarchyLevel;

    @NotEmpty
    private List<String> measures;

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy;
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
}
