package org.iceforge.olap.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * One window column. Fields may name dimensions, measures or columns added by earlier calculations of the same
 * request.
 */
public class WindowCalculation {

    /**
     * running_total, moving_avg, rank, lag, ... (see WindowFunction).
     */
    @NotBlank
    private String function;

    /**
     * Dimension or measure the function reads. Ranking functions do not need one.
     */
    private String valueField;

    private List<String> partitionBy = new ArrayList<>();

    @Valid
    private List<OrderBy> orderBy = new ArrayList<>();

    private Integer size;

    private Integer offset;

    private Integer buckets;

    private Object defaultValue;

    private String outputName;

    public WindowCalculation() {
    }

    public WindowCalculation(String function, String valueField) {
        this.function = function;
        this.valueField = valueField;
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getValueField() {
        return valueField;
    }

    public void setValueField(String valueField) {
        this.valueField = valueField;
    }

    public List<String> getPartitionBy() {
        return partitionBy;
    }

    public void setPartitionBy(List<String> partitionBy) {
        this.partitionBy = partitionBy;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(List<OrderBy> orderBy) {
        this.orderBy = orderBy;
    }

    public Integer getSize() {
        return size;
    }

    public void setSize(Integer size) {
        this.size = size;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public Integer getBuckets() {
        return buckets;
    }

    public void setBuckets(Integer buckets) {
        this.buckets = buckets;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String getOutputName() {
        return outputName;
    }

    public void setOutputName(String outputName) {
        this.outputName = outputName;
    }

    public static class OrderBy {

        @NotBlank
        private String field;

        @Pattern(regexp = "(?i)asc|desc")
        private String direction = "asc";

        public OrderBy() {
        }

        public OrderBy(String field, String direction) {
            this.field = field;
            this.direction = direction;
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getDirection() {
            return direction;
        }

        public void setDirection(String direction) {
            this.direction = direction;
        }

        public boolean isDescending() {
            return "desc".equalsIgnoreCase(direction);
        }
    }
}
