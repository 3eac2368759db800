package org.iceforge.olap.engine.timeseries;

import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.data.ResultRow;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowKind;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.engine.aggregate.AggregationEngine;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.semantic.AggregationFunction;
import org.iceforge.olap.semantic.FieldRef;
import org.iceforge.olap.semantic.MeasureRef;
import org.iceforge.olap.semantic.TimeGrain;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeSeriesEngineTest {

    private final TimeSeriesEngine engine = new TimeSeriesEngine(new AggregationEngine(NullOrdering.LAST));

    private final FieldRef date = new FieldRef("date", 0, ColumnKind.TIMESTAMP);
    private final FieldRef region = new FieldRef("region", 1, ColumnKind.STRING);
    private final MeasureRef sales = new MeasureRef("sales", 2, AggregationFunction.SUM);

    private static RowSet.Builder rows() {
        return RowSet.builder()
                .column("date", ColumnKind.TIMESTAMP)
                .column("region", ColumnKind.STRING)
                .column("sales", ColumnKind.NUMBER);
    }

    @Test
    void fillsMissingMonthsWithNulls() {
        RowSet input = rows()
                .row("2024-01-15", "East", 100)
                .row("2024-01-20", "West", 50)
                .row("2024-03-02", "East", 30)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales),
                TimeSeriesOptions.DEFAULTS);

        assertThat(result.column("date")).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 2, 1, 0, 0),
                LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(result.column("sales")).containsExactly(150.0, null, 30.0);
        assertThat(result.getRows().get(1).group().kind()).isEqualTo(RowKind.FILLED);
        assertThat(result.getRows().get(0).group().bucket()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    @Test
    void emptyInputOverRangeYieldsOneNullRowPerMonth() {
        TimeSeriesOptions options = new TimeSeriesOptions(LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 6, 30, 23, 59), true, null, List.of(), false);

        ResultTable result = engine.timeSeries(rows().build(), date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.size()).isEqualTo(6);
        assertThat(result.column("sales")).containsOnlyNulls();
    }

    @Test
    void withoutGapFillingOnlyObservedBucketsRemain() {
        RowSet input = rows()
                .row("2024-01-15", "East", 100)
                .row("2024-03-02", "East", 30)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(null, null, false, null, List.of(), false);

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.column("sales")).containsExactly(100.0, 30.0);
    }

    @Test
    void rowsOutsideTheRangeAreExcluded() {
        RowSet input = rows()
                .row("2023-12-31", "East", 1)
                .row("2024-01-10", "East", 10)
                .row("2024-01-25", "East", 20)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 1, 20, 0, 0), true, null, List.of(), false);

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.column("sales")).containsExactly(10.0);
    }

    @Test
    void weeksStartOnMonday() {
        RowSet input = rows()
                .row("2024-01-03", "East", 1)
                .row("2024-01-07T18:30", "East", 2)
                .row("2024-01-08", "East", 4)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.WEEK, List.of(sales),
                TimeSeriesOptions.DEFAULTS);

        assertThat(result.column("date")).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 1, 8, 0, 0));
        assertThat(result.column("sales")).containsExactly(3.0, 4.0);
    }

    @Test
    void acceptsMixedTemporalTypes() {
        RowSet input = rows()
                .row(LocalDate.of(2024, 5, 17), "East", 1)
                .row(Instant.parse("2024-06-30T23:00:00Z"), "East", 2)
                .row(LocalDateTime.of(2024, 4, 1, 0, 0), "East", 4)
                .row(null, "East", 100)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.QUARTER, List.of(sales),
                TimeSeriesOptions.DEFAULTS);

        assertThat(result.column("date")).containsExactly(LocalDateTime.of(2024, 4, 1, 0, 0));
        assertThat(result.column("sales")).containsExactly(7.0);
    }

    @Test
    void unparseableTimestampIsMalformed() {
        RowSet input = rows().row("yesterday", "East", 1).build();

        assertThatThrownBy(() -> engine.timeSeries(input, date, TimeGrain.DAY, List.of(sales),
                TimeSeriesOptions.DEFAULTS))
                .isInstanceOf(MalformedInputException.class);
    }

    @Test
    void monthOverMonthAddsPriorDeltaAndChange() {
        RowSet input = rows()
                .row("2024-01-15", "East", 100)
                .row("2024-02-15", "East", 150)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales),
                TimeSeriesOptions.DEFAULTS.withComparison(PeriodComparison.MOM));

        assertThat(result.columnNames()).containsExactly("date", "sales", "sales_prior", "sales_delta",
                "sales_pct_change");
        assertThat(result.getRows().get(0).cells()).containsExactly(LocalDateTime.of(2024, 1, 1, 0, 0), 100.0,
                null, null, null);
        assertThat(result.getRows().get(1).cells()).containsExactly(LocalDateTime.of(2024, 2, 1, 0, 0), 150.0,
                100.0, 50.0, 0.5);
    }

    @Test
    void yearOverYearReadsPriorPeriodOutsideTheRange() {
        RowSet input = rows()
                .row("2023-01-10", "East", 80)
                .row("2024-01-10", "East", 100)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 1, 31, 0, 0), true, PeriodComparison.YOY, List.of(), false);

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.value(0, "sales_prior")).isEqualTo(80.0);
        assertThat(result.value(0, "sales_delta")).isEqualTo(20.0);
        assertThat(result.value(0, "sales_pct_change")).isEqualTo(0.25);
    }

    @Test
    void zeroPriorGivesNullChange() {
        RowSet input = rows()
                .row("2024-01-01", "East", 0)
                .row("2024-01-02", "East", 5)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.DAY, List.of(sales),
                TimeSeriesOptions.DEFAULTS.withComparison(PeriodComparison.DOD));

        assertThat(result.value(1, "sales_delta")).isEqualTo(5.0);
        assertThat(result.value(1, "sales_pct_change")).isNull();
    }

    @Test
    void weeklyYearOverYearMatchesIsoWeek() {
        LocalDateTime week10of2024 = LocalDateTime.of(2024, 3, 4, 0, 0);

        assertThat(TimeSeriesEngine.priorBucket(week10of2024, TimeGrain.WEEK, PeriodComparison.YOY))
                .isEqualTo(LocalDateTime.of(2023, 3, 6, 0, 0));
    }

    @Test
    void rejectsComparisonsThatDoNotFitTheGrain() {
        RowSet input = rows().row("2024-01-01", "East", 1).build();

        assertThatThrownBy(() -> engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales),
                TimeSeriesOptions.DEFAULTS.withComparison(PeriodComparison.DOD)))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> engine.timeSeries(input, date, TimeGrain.WEEK, List.of(sales),
                TimeSeriesOptions.DEFAULTS.withComparison(PeriodComparison.MOM)))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void seriesShareOneSpine() {
        RowSet input = rows()
                .row("2024-01-05", "East", 10)
                .row("2024-03-05", "East", 30)
                .row("2024-02-05", "West", 20)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(null, null, true, null, List.of(region), false);

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.size()).isEqualTo(6);
        ResultRow febEast = result.getRows().get(2);
        assertThat(febEast.cells()).containsExactly(LocalDateTime.of(2024, 2, 1, 0, 0), "East", null);
        assertThat(febEast.group().kind()).isEqualTo(RowKind.FILLED);
        assertThat(result.getRows().get(3).cells())
                .containsExactly(LocalDateTime.of(2024, 2, 1, 0, 0), "West", 20.0);
    }

    @Test
    void trendAddsMovingAverageAndDirection() {
        RowSet input = rows()
                .row("2024-01-10", "East", 100)
                .row("2024-02-10", "East", 150)
                .row("2024-04-10", "East", 120)
                .row("2024-05-10", "East", 120)
                .row("2024-06-10", "East", 90)
                .build();

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales),
                TimeSeriesOptions.DEFAULTS.withTrend());

        assertThat(result.columnNames()).containsExactly("date", "sales", "sales_ma3", "sales_trend");
        assertThat(result.column("sales")).containsExactly(100.0, 150.0, null, 120.0, 120.0, 90.0);
        assertThat(result.column("sales_ma3")).containsExactly(100.0, 125.0, 125.0, 135.0, 120.0, 110.0);
        assertThat(result.column("sales_trend")).containsExactly("stable", "up", "stable", "stable", "stable",
                "down");
    }

    @Test
    void trendRestartsPerSeries() {
        RowSet input = rows()
                .row("2024-01-05", "East", 10)
                .row("2024-02-05", "East", 30)
                .row("2024-01-05", "West", 50)
                .row("2024-02-05", "West", 20)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(null, null, true, null, List.of(region), true);

        ResultTable result = engine.timeSeries(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.column("region")).containsExactly("East", "West", "East", "West");
        assertThat(result.column("sales_ma3")).containsExactly(10.0, 50.0, 20.0, 35.0);
        assertThat(result.column("sales_trend")).containsExactly("stable", "stable", "up", "down");
    }

    @Test
    void summaryPerSeries() {
        RowSet input = rows()
                .row("2024-01-05", "East", 10)
                .row("2024-03-05", "East", 30)
                .row("2024-02-05", "West", 20)
                .build();
        TimeSeriesOptions options = new TimeSeriesOptions(null, null, true, null, List.of(region), false);

        ResultTable result = engine.summary(input, date, TimeGrain.MONTH, List.of(sales), options);

        assertThat(result.columnNames()).containsExactly("region", "measure", "count", "min", "max", "sum", "avg",
                "first", "last", "total_change");
        assertThat(result.getRows().get(0).cells()).containsExactly("East", "sales", 2L, 10.0, 30.0, 40.0, 20.0,
                10.0, 30.0, 20.0);
        assertThat(result.getRows().get(1).cells()).containsExactly("West", "sales", 1L, 20.0, 20.0, 20.0, 20.0,
                20.0, 20.0, 0.0);
    }

    @Test
    void summaryOfEmptyInput() {
        ResultTable result = engine.summary(rows().build(), date, TimeGrain.DAY, List.of(sales), null);

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.getRows().get(0).cells()).containsExactly("sales", 0L, null, null, null, null, null,
                null, null);
    }
}
