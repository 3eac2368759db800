package org.iceforge.olap.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Top-N / bottom-N with contribution analysis. Rows are aggregated by {@link #groupBy} first.
 */
public class ParetoRequest extends AnalyticsRequest {

    @NotEmpty
    private List<String> groupBy;

    @NotBlank
    private String measure;

    @Positive
    private Integer limit;

    private boolean bottom;

    /**
     * Cumulative percentage cut-offs; the configured defaults apply when absent.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double classAThreshold;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double classBThreshold;

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy;
    }

    public String getMeasure() {
        return measure;
    }

    public void setMeasure(String measure) {
        this.measure = measure;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public boolean isBottom() {
        return bottom;
    }

    public void setBottom(boolean bottom) {
        this.bottom = bottom;
    }

    public Double getClassAThreshold() {
        return classAThreshold;
    }

    public void setClassAThreshold(Double classAThreshold) {
        this.classAThreshold = classAThreshold;
    }

    public Double getClassBThreshold() {
        return classBThreshold;
    }

    public void setClassBThreshold(Double classBThreshold) {
        this.classBThreshold = classBThreshold;
    }
}
