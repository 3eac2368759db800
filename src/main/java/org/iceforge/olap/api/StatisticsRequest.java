package org.iceforge.olap.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared by summary, percentiles, distribution and correlation. Statistics read the raw values of the measures'
 * input columns.
 */
public class StatisticsRequest extends AnalyticsRequest {

    @NotEmpty
    private List<String> measures;

    /**
     * Grouping for summary statistics; ignored by the other statistics.
     */
    private List<String> groupBy = new ArrayList<>();

    /**
     * Quantiles in [0, 1]; defaults to 0.25, 0.5, 0.75, 0.9, 0.95, 0.99.
     */
    private List<@NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double> percentiles = new ArrayList<>();

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy;
    }

    public List<Double> getPercentiles() {
        return percentiles;
    }

    public void setPercentiles(List<Double> percentiles) {
        this.percentiles = percentiles;
    }
}
