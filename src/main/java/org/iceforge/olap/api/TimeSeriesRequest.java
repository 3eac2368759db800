package org.iceforge.olap.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class TimeSeriesRequest extends AnalyticsRequest {

    /**
     * Temporal dimension to bucket by; defaults to the dataset's time dimension.
     */
    private String timeDimension;

    /**
     * year | quarter | month | week | day | hour
     */
    @NotBlank
    private String grain;

    @NotEmpty
    private List<String> measures;

    /**
     * Inclusive ISO-8601 bounds, e.g. 2024-01-01.
     */
    private String dateFrom;

    private String dateTo;

    private boolean fillGaps = true;

    /**
     * yoy | qoq | mom | wow | dod
     */
    private String comparison;

    private List<String> seriesBy = new ArrayList<>();

    /**
     * Adds {@code <measure>_ma3} and {@code <measure>_trend} (up, down, stable) columns.
     */
    private boolean trend;

    public String getTimeDimension() {
        return timeDimension;
    }

    public void setTimeDimension(String timeDimension) {
        this.timeDimension = timeDimension;
    }

    public String getGrain() {
        return grain;
    }

    public void setGrain(String grain) {
        this.grain = grain;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public String getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(String dateFrom) {
        this.dateFrom = dateFrom;
    }

    public String getDateTo() {
        return dateTo;
    }

    public void setDateTo(String dateTo) {
        this.dateTo = dateTo;
    }

    public boolean isFillGaps() {
        return fillGaps;
    }

    public void setFillGaps(boolean fillGaps) {
        this.fillGaps = fillGaps;
    }

    public String getComparison() {
        return comparison;
    }

    public void setComparison(String comparison) {
        this.comparison = comparison;
    }

    public List<String> getSeriesBy() {
        return seriesBy;
    }

    public void setSeriesBy(List<String> seriesBy) {
        this.seriesBy = seriesBy;
    }

    public boolean isTrend() {
        return trend;
    }

    public void setTrend(boolean trend) {
        this.trend = trend;
    }
}
