package org.iceforge.olap.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public class OutlierRequest extends AnalyticsRequest {

    @NotBlank
    private String measure;

    @Pattern(regexp = "(?i)iqr|z-?score|z_score")
    private String method = "iqr";

    /**
     * IQR multiplier (1.5 by default) or absolute z-score (3.0 by default).
     */
    @Positive
    private Double threshold;

    public String getMeasure() {
        return measure;
    }

    public void setMeasure(String measure) {
        this.measure = measure;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }
}
