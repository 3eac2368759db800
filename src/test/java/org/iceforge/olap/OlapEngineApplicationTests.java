package org.iceforge.olap;

import org.iceforge.olap.api.AggregateRequest;
import org.iceforge.olap.api.FilterCondition;
import org.iceforge.olap.api.ParetoRequest;
import org.iceforge.olap.api.StatisticsRequest;
import org.iceforge.olap.api.SubtotalRequest;
import org.iceforge.olap.api.TimeSeriesRequest;
import org.iceforge.olap.api.WindowCalculation;
import org.iceforge.olap.api.WindowRequest;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.ColumnRole;
import org.iceforge.olap.data.ResultColumn;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowKind;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.UnknownFieldException;
import org.iceforge.olap.service.AnalyticsService;
import org.iceforge.olap.service.SemanticModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@SpringBootTest
class OlapEngineApplicationTests {

    @Autowired
    AnalyticsService analytics;

    @Autowired
    SemanticModelRegistry registry;

    private final RowSet orders = RowSet.builder()
            .column("order_id", ColumnKind.NUMBER)
            .column("order_date", ColumnKind.TIMESTAMP)
            .column("region", ColumnKind.STRING)
            .column("category", ColumnKind.STRING)
            .column("product", ColumnKind.STRING)
            .column("amount", ColumnKind.NUMBER)
            .column("quantity", ColumnKind.NUMBER)
            .row(1, LocalDate.of(2024, 1, 5), "East", "Hardware", "Drill", 100.0, 1)
            .row(2, LocalDate.of(2024, 1, 20), "East", "Garden", "Hose", 120.0, 2)
            .row(3, LocalDate.of(2024, 2, 3), "West", "Hardware", "Saw", 50.0, 1)
            .build();

    @Test
    void loadsBundledModel() {
        assertThat(registry.current().getVersion()).isPositive();
        assertThat(registry.dataset("sales").getHierarchies()).containsKeys("calendar", "geography", "catalogue");
    }

    @Test
    void aggregatesByRegion() {
        var req = new AggregateRequest();
        req.setGroupBy(List.of("region"));
        req.setMeasures(List.of("revenue", "orders"));

        ResultTable result = analytics.aggregate("sales", orders, req);

        assertThat(result.columnNames()).containsExactly("region", "revenue", "orders");
        assertThat(result.getRows().get(0).cells()).containsExactly("East", 220.0, 2L);
        assertThat(result.getRows().get(1).cells()).containsExactly("West", 50.0, 1L);
    }

    @Test
    void appliesDimensionFilters() {
        var req = new AggregateRequest();
        req.setMeasures(List.of("revenue"));
        req.setFilters(Map.of("region", List.of("West")));

        ResultTable result = analytics.aggregate("sales", orders, req);

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.value(0, "revenue")).isEqualTo(50.0);
    }

    @Test
    void appliesOperatorConditions() {
        var req = new AggregateRequest();
        req.setGroupBy(List.of("product"));
        req.setMeasures(List.of("revenue"));
        req.setConditions(List.of(
                new FilterCondition("revenue", ">=", 60),
                new FilterCondition("order_date", "between", List.of("2024-01-01", "2024-01-31")),
                new FilterCondition("category", "not in", List.of("Garden"))));

        ResultTable result = analytics.aggregate("sales", orders, req);

        assertThat(result.column("product")).containsExactly("Drill");
        assertThat(result.column("revenue")).containsExactly(100.0);
    }

    @Test
    void rejectsUnknownFilterOperator() {
        var req = new AggregateRequest();
        req.setMeasures(List.of("revenue"));
        req.setConditions(List.of(new FilterCondition("region", "like", "E%")));

        assertThatThrownBy(() -> analytics.aggregate("sales", orders, req))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("like");
    }

    @Test
    void rejectsInvalidRequests() {
        var empty = new AggregateRequest();
        empty.setGroupBy(List.of("region"));

        assertThatThrownBy(() -> analytics.aggregate("sales", orders, empty))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("measures");

        var both = new AggregateRequest();
        both.setGroupBy(List.of("region"));
        both.setHierarchy("geography");
        both.setMeasures(List.of("revenue"));

        assertThatThrownBy(() -> analytics.aggregate("sales", orders, both))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void unknownDatasetIsReported() {
        var req = new AggregateRequest();
        req.setMeasures(List.of("revenue"));

        assertThatThrownBy(() -> analytics.aggregate("returns", orders, req))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("returns");
    }

    @Test
    void rollsUpAlongHierarchy() {
        var req = new SubtotalRequest();
        req.setHierarchy("catalogue");
        req.setMeasures(List.of("revenue"));

        ResultTable result = analytics.rollup("sales", orders, req);

        assertThat(result.columnNames()).startsWith("category", "product");
        var grandTotal = result.getRows().get(result.size() - 1);
        assertThat(grandTotal.group().kind()).isEqualTo(RowKind.GRAND_TOTAL);
        assertThat(result.value(result.size() - 1, "revenue")).isEqualTo(270.0);
    }

    @Test
    void rollupWithPercentOfTotal() {
        var req = new SubtotalRequest();
        req.setDimensions(List.of("region"));
        req.setMeasures(List.of("revenue"));
        req.setPercentOfTotal(true);

        ResultTable result = analytics.rollup("sales", orders, req);

        assertThat(result.column("region")).containsExactly("East", "West", null);
        assertThat((Double) result.value(1, "revenue_pct_total")).isCloseTo(100.0 * 50 / 270, offset(1e-9));
        assertThat(result.value(2, "revenue_pct_total")).isEqualTo(100.0);
    }

    @Test
    void monthlyTrendAndSummary() {
        var req = new TimeSeriesRequest();
        req.setGrain("month");
        req.setMeasures(List.of("revenue"));
        req.setTrend(true);

        ResultTable series = analytics.timeSeries("sales", orders, req);

        assertThat(series.column("revenue_ma3")).containsExactly(220.0, 135.0);
        assertThat(series.column("revenue_trend")).containsExactly("stable", "down");

        ResultTable summary = analytics.timeSeriesSummary("sales", orders, req);

        assertThat(summary.getRows().get(0).cells()).containsExactly("revenue", 2L, 50.0, 220.0, 270.0, 135.0,
                220.0, 50.0, -170.0);
    }

    @Test
    void monthlySeriesWithMonthOverMonth() {
        var req = new TimeSeriesRequest();
        req.setGrain("month");
        req.setMeasures(List.of("revenue"));
        req.setComparison("mom");

        ResultTable result = analytics.timeSeries("sales", orders, req);

        assertThat(result.column("order_date")).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 2, 1, 0, 0));
        assertThat(result.column("revenue")).containsExactly(220.0, 50.0);
        assertThat(result.value(1, "revenue_prior")).isEqualTo(220.0);
        assertThat(result.value(1, "revenue_delta")).isEqualTo(-170.0);
    }

    @Test
    void dateBoundsCoverWholePeriods() {
        var req = new TimeSeriesRequest();
        req.setGrain("day");
        req.setMeasures(List.of("revenue"));
        req.setDateFrom("2024-01-20");
        req.setDateTo("2024-01");

        ResultTable result = analytics.timeSeries("sales", orders, req);

        assertThat(result.size()).isEqualTo(12);
        assertThat(result.value(0, "revenue")).isEqualTo(120.0);
    }

    @Test
    void grainFinerThanTimeDimensionIsRejected() {
        var req = new TimeSeriesRequest();
        req.setGrain("hour");
        req.setMeasures(List.of("revenue"));

        assertThatThrownBy(() -> analytics.timeSeries("sales", orders, req))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void runningTotalOverOrderDate() {
        var calc = new WindowCalculation("running_total", "revenue");
        calc.setOrderBy(List.of(new WindowCalculation.OrderBy("order_date", "asc")));
        var req = new WindowRequest();
        req.setCalculations(List.of(calc));

        ResultTable result = analytics.window("sales", orders, req);

        assertThat(result.column("revenue_running_total")).containsExactly(100.0, 220.0, 270.0);
        assertThat(result.getColumns().get(result.indexOf("amount")).role()).isEqualTo(ColumnRole.ATTRIBUTE);
    }

    @Test
    void rankOverGroupedRows() {
        var calc = new WindowCalculation("rank", null);
        calc.setOrderBy(List.of(new WindowCalculation.OrderBy("revenue", "desc")));
        var req = new WindowRequest();
        req.setCalculations(List.of(calc));
        req.setGroupBy(List.of("category"));
        req.setMeasures(List.of("revenue"));

        ResultTable result = analytics.window("sales", orders, req);

        assertThat(result.column("category")).containsExactly("Hardware", "Garden");
        assertThat(result.column("rank")).containsExactly(1L, 2L);
        assertThat(result.getColumns()).extracting(ResultColumn::role)
                .containsExactly(ColumnRole.DIMENSION, ColumnRole.MEASURE, ColumnRole.DERIVED);
    }

    @Test
    void chainedWindowCalculationsWithLimit() {
        var total = new WindowCalculation("running_total", "revenue");
        total.setOrderBy(List.of(new WindowCalculation.OrderBy("order_date", "asc")));
        var change = new WindowCalculation("difference_from_previous", "revenue_running_total");
        change.setOrderBy(List.of(new WindowCalculation.OrderBy("order_date", "asc")));
        change.setOutputName("step");
        var req = new WindowRequest();
        req.setCalculations(List.of(total, change));
        req.setLimit(2);

        ResultTable result = analytics.window("sales", orders, req);

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.column("revenue_running_total")).containsExactly(100.0, 220.0);
        assertThat(result.column("step")).containsExactly(100.0, 120.0);
    }

    @Test
    void windowOutputNamesMustBeUnique() {
        var first = new WindowCalculation("row_number", null);
        var second = new WindowCalculation("row_number", null);
        var req = new WindowRequest();
        req.setCalculations(List.of(first, second));

        assertThatThrownBy(() -> analytics.window("sales", orders, req))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("row_number");

        var noCalculations = new WindowRequest();
        assertThatThrownBy(() -> analytics.window("sales", orders, noCalculations))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("calculations");
    }

    @Test
    void summaryStatistics() {
        var req = new StatisticsRequest();
        req.setMeasures(List.of("revenue"));

        ResultTable result = analytics.summary("sales", orders, req);

        assertThat(result.value(0, "measure")).isEqualTo("revenue");
        assertThat(result.value(0, "count")).isEqualTo(3L);
        assertThat(result.value(0, "median")).isEqualTo(100.0);
    }

    @Test
    void paretoOverProducts() {
        var req = new ParetoRequest();
        req.setGroupBy(List.of("product"));
        req.setMeasure("revenue");

        ResultTable result = analytics.pareto("sales", orders, req);

        assertThat(result.column("product")).containsExactly("Hose", "Drill", "Saw");
        assertThat(result.column("cumulative")).containsExactly(120.0, 220.0, 270.0);
        assertThat(result.column("pareto_class")).containsExactly("A", "B", "C");
        assertThat(result.value(2, "cumulative_pct")).isEqualTo(100.0);
    }
}
