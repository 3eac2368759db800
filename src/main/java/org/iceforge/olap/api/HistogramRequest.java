package org.iceforge.olap.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public class HistogramRequest extends AnalyticsRequest {

    @NotBlank
    private String measure;

    @Positive
    private Integer binCount;

    @Positive
    private Double binWidth;

    private Double min;

    private Double max;

    public String getMeasure() {
        return measure;
    }

    public void setMeasure(String measure) {
        this.measure = measure;
    }

    public Integer getBinCount() {
        return binCount;
    }

    public void setBinCount(Integer binCount) {
        this.binCount = binCount;
    }

    public Double getBinWidth() {
        return binWidth;
    }

    public void setBinWidth(Double binWidth) {
        this.binWidth = binWidth;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }
}
