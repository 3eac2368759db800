package org.iceforge.olap.api;

import jakarta.validation.constraints.NotBlank;

/**
 * A condition on one dimension or on the column behind a measure, e.g.
 * {@code {"field":"revenue","operator":">=","value":100}}. Measure conditions test the input rows, before
 * aggregation.
 */
public class FilterCondition {

    @NotBlank
    private String field;

    /**
     * = != &lt;&gt; &gt; &gt;= &lt; &lt;= in, not in, between, is null, is not null
     */
    @NotBlank
    private String operator = "=";

    /**
     * Scalar, or a list for in / not in and a two-element list for between. Absent for the null checks.
     */
    private Object value;

    public FilterCondition() {
    }

    public FilterCondition(String field, String operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }
}
