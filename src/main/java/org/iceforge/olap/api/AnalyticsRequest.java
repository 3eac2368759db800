package org.iceforge.olap.api;

import jakarta.validation.Valid;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Common part of every analytics request.
 */
public abstract class AnalyticsRequest {

    /**
     * Dimension IN-filters applied to the input before anything else, e.g. {"region":["East","West"]}.
     */
    private Map<String, List<Object>> filters;

    /**
     * Operator conditions, combined with each other and with {@link #filters} by AND.
     */
    @Valid
    private List<FilterCondition> conditions = new ArrayList<>();

    public Map<String, List<Object>> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, List<Object>> filters) {
        this.filters = filters;
    }

    public List<FilterCondition> getConditions() {
        return conditions;
    }

    public void setConditions(List<FilterCondition> conditions) {
        this.conditions = conditions;
    }
}
