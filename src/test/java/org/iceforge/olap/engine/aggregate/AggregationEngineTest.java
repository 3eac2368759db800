package org.iceforge.olap.engine.aggregate;

import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.data.ResultRow;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowKind;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.semantic.AggregationFunction;
import org.iceforge.olap.semantic.FieldRef;
import org.iceforge.olap.semantic.MeasureRef;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class AggregationEngineTest {

    private final AggregationEngine engine = new AggregationEngine(NullOrdering.LAST);

    private final FieldRef region = new FieldRef("region", 0, ColumnKind.STRING);
    private final FieldRef month = new FieldRef("month", 1, ColumnKind.STRING);
    private final MeasureRef sales = new MeasureRef("sales", 2, AggregationFunction.SUM);

    private final RowSet rows = RowSet.builder()
            .column("region", ColumnKind.STRING)
            .column("month", ColumnKind.STRING)
            .column("sales", ColumnKind.NUMBER)
            .row("East", "2024-01", 100)
            .row("West", "2024-01", 50)
            .row("East", "2024-02", 120)
            .build();

    @Test
    void sumsSalesPerRegion() {
        ResultTable result = engine.aggregate(rows, List.of(region), List.of(sales));

        assertThat(result.columnNames()).containsExactly("region", "sales");
        assertThat(result.column("region")).containsExactly("East", "West");
        assertThat(result.column("sales")).containsExactly(220.0, 50.0);
    }

    @Test
    void nullIsItsOwnGroupAndSortsLast() {
        RowSet withNull = RowSet.builder()
                .column("region", ColumnKind.STRING)
                .column("month", ColumnKind.STRING)
                .column("sales", ColumnKind.NUMBER)
                .row(null, "2024-01", 5)
                .row("West", "2024-01", 50)
                .row(null, "2024-02", 7)
                .build();

        ResultTable result = engine.aggregate(withNull, List.of(region), List.of(sales));

        assertThat(result.column("region")).containsExactly("West", null);
        assertThat(result.column("sales")).containsExactly(50.0, 12.0);

        ResultTable nullsFirst = new AggregationEngine(NullOrdering.FIRST).aggregate(withNull, List.of(region),
                List.of(sales));
        assertThat(nullsFirst.column("region")).containsExactly(null, "West");
    }

    @Test
    void emptyInputWithoutGroupingYieldsOneTotalRow() {
        RowSet empty = RowSet.builder().column("v", ColumnKind.NUMBER).build();
        List<MeasureRef> measures = List.of(
                new MeasureRef("s", 0, AggregationFunction.SUM),
                new MeasureRef("c", 0, AggregationFunction.COUNT),
                new MeasureRef("d", 0, AggregationFunction.COUNT_DISTINCT),
                new MeasureRef("a", 0, AggregationFunction.AVG),
                new MeasureRef("lo", 0, AggregationFunction.MIN),
                new MeasureRef("hi", 0, AggregationFunction.MAX));

        ResultTable result = engine.aggregate(empty, List.of(), measures);

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.getRows().get(0).cells()).containsExactly(0.0, 0L, 0L, null, null, null);
    }

    @Test
    void functionsIgnoreNulls() {
        RowSet values = RowSet.builder()
                .column("v", ColumnKind.NUMBER)
                .row(4).row((Object) null).row(4).row(10)
                .build();
        List<MeasureRef> measures = List.of(
                new MeasureRef("c", 0, AggregationFunction.COUNT),
                new MeasureRef("d", 0, AggregationFunction.COUNT_DISTINCT),
                new MeasureRef("a", 0, AggregationFunction.AVG),
                new MeasureRef("lo", 0, AggregationFunction.MIN),
                new MeasureRef("hi", 0, AggregationFunction.MAX));

        ResultRow row = engine.aggregate(values, List.of(), measures).getRows().get(0);

        assertThat(row.cells()).containsExactly(3L, 2L, 6.0, 4L, 10L);
    }

    @Test
    void countDistinctComparesNumbersByValue() {
        RowSet mixed = RowSet.builder()
                .column("region", ColumnKind.STRING)
                .column("qty", ColumnKind.NUMBER)
                .row("a", 1)
                .row("a", 1.0)
                .row("a", new BigDecimal("1.00"))
                .row("a", 2L)
                .build();
        MeasureRef distinct = new MeasureRef("d", 1, AggregationFunction.COUNT_DISTINCT);

        ResultTable result = engine.aggregate(mixed, List.of(new FieldRef("region", 0, ColumnKind.STRING)),
                List.of(distinct));

        assertThat(result.column("d")).containsExactly(2L);
    }

    @Test
    void minAndMaxAcceptStrings() {
        MeasureRef first = new MeasureRef("first_month", 1, AggregationFunction.MIN);
        MeasureRef last = new MeasureRef("last_month", 1, AggregationFunction.MAX);

        ResultTable result = engine.aggregate(rows, List.of(region), List.of(first, last));

        assertThat(result.getRows().get(0).cells()).containsExactly("East", "2024-01", "2024-02");
        assertThat(result.getColumns().get(1).kind()).isEqualTo(ColumnKind.STRING);
    }

    @Test
    void sumOverTextIsMalformed() {
        MeasureRef bad = new MeasureRef("bad", 0, AggregationFunction.SUM);

        assertThatThrownBy(() -> engine.aggregate(rows, List.of(), List.of(bad)))
                .isInstanceOf(MalformedInputException.class);
    }

    @Test
    void rollupProducesAllLevelsFromDetailToGrandTotal() {
        ResultTable result = engine.rollup(rows, List.of(region, month), List.of(sales));

        List<Integer> levels = new ArrayList<>();
        for (ResultRow r : result.getRows()) {
            levels.add(r.group().subtotalLevel());
        }
        assertThat(levels).containsExactly(2, 2, 2, 1, 1, 0);

        ResultRow subtotal = result.getRows().get(3);
        assertThat(subtotal.group().kind()).isEqualTo(RowKind.SUBTOTAL);
        assertThat(subtotal.group().collapsed()).containsExactly("month");
        assertThat(subtotal.cells()).containsExactly("East", null, 220.0);

        ResultRow total = result.getRows().get(5);
        assertThat(total.group().kind()).isEqualTo(RowKind.GRAND_TOTAL);
        assertThat(total.cells()).containsExactly(null, null, 270.0);

        ResultTable plain = engine.aggregate(rows, List.of(), List.of(sales));
        assertThat(total.get(2)).isEqualTo(plain.value(0, "sales"));
    }

    @Test
    void rollupPercentOfGrandTotal() {
        ResultTable rollup = engine.rollup(rows, List.of(region), List.of(sales));

        ResultTable result = engine.withPercentOfTotal(rollup, List.of(sales));

        assertThat(result.columnNames()).containsExactly("region", "sales", "sales_pct_total");
        assertThat((Double) result.value(0, "sales_pct_total")).isCloseTo(100.0 * 220 / 270, offset(1e-9));
        assertThat((Double) result.value(1, "sales_pct_total")).isCloseTo(100.0 * 50 / 270, offset(1e-9));
        assertThat(result.value(2, "sales_pct_total")).isEqualTo(100.0);
        assertThat(result.getRows().get(2).group().kind()).isEqualTo(RowKind.GRAND_TOTAL);
    }

    @Test
    void percentOfTotalNeedsAGrandTotalRow() {
        ResultTable sets = engine.groupingSets(rows, List.of(region, month), List.of(List.of("region")),
                List.of(sales));

        assertThatThrownBy(() -> engine.withPercentOfTotal(sets, List.of(sales)))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("grand total");
    }

    @Test
    void cubeFollowsGroupingBitOrder() {
        ResultTable result = engine.cube(rows, List.of(region, month), List.of(sales));

        List<List<String>> groupings = new ArrayList<>();
        for (ResultRow r : result.getRows()) {
            if (!groupings.contains(r.group().groupedBy())) {
                groupings.add(r.group().groupedBy());
            }
        }
        assertThat(groupings).containsExactly(
                List.of("region", "month"), List.of("region"), List.of("month"), List.of());

        double regionLevel = 0;
        for (ResultRow r : result.getRows()) {
            if (r.group().groupedBy().equals(List.of("region"))) {
                regionLevel += (Double) r.get(2);
            }
        }
        ResultRow last = result.getRows().get(result.size() - 1);
        assertThat(last.group().kind()).isEqualTo(RowKind.GRAND_TOTAL);
        assertThat(regionLevel).isEqualTo((Double) last.get(2));
    }

    @Test
    void groupingSetsKeepCallerOrderAndTagSetIndex() {
        ResultTable result = engine.groupingSets(rows, List.of(region, month),
                List.of(List.of("month"), List.of()), List.of(sales));

        assertThat(result.size()).isEqualTo(3);
        assertThat(result.getRows().get(0).group().groupingSet()).isEqualTo(0);
        assertThat(result.getRows().get(0).cells()).containsExactly(null, "2024-01", 150.0);
        assertThat(result.getRows().get(2).group().groupingSet()).isEqualTo(1);
        assertThat(result.getRows().get(2).cells()).containsExactly(null, null, 270.0);
    }

    @Test
    void groupingSetOutsideDimensionsIsRejected() {
        assertThatThrownBy(() -> engine.groupingSets(rows, List.of(region), List.of(List.of("month")),
                List.of(sales)))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("month");
    }

    @Test
    void pivotSpreadsObservedColumnKeys() {
        ResultTable result = engine.pivot(rows, List.of(region), List.of(month), List.of(sales),
                PivotOptions.DEFAULTS);

        assertThat(result.columnNames()).containsExactly("region", "2024-01_sales", "2024-02_sales",
                "total_sales");
        assertThat(result.getRows().get(0).cells()).containsExactly("East", 100.0, 120.0, 220.0);
        assertThat(result.getRows().get(1).cells()).containsExactly("West", 50.0, null, 50.0);

        ResultRow total = result.getRows().get(2);
        assertThat(total.group().kind()).isEqualTo(RowKind.GRAND_TOTAL);
        assertThat(total.cells()).containsExactly(null, 150.0, 120.0, 270.0);
    }

    @Test
    void pivotCellsSumToGrandTotal() {
        ResultTable result = engine.pivot(rows, List.of(region), List.of(month), List.of(sales),
                PivotOptions.DEFAULTS);

        double sum = 0;
        for (ResultRow r : result.getRows()) {
            if (r.group().isTotal()) {
                continue;
            }
            for (String c : List.of("2024-01_sales", "2024-02_sales")) {
                Object v = r.get(result.indexOf(c));
                sum += v == null ? 0.0 : (Double) v;
            }
        }
        assertThat(sum).isEqualTo(result.value(2, "total_sales"));
    }

    @Test
    void pivotWithoutTotalsAndAsRowShares() {
        ResultTable result = engine.pivot(rows, List.of(region), List.of(month), List.of(sales),
                new PivotOptions(false, PercentageOf.ROW));

        assertThat(result.columnNames()).containsExactly("region", "2024-01_sales", "2024-02_sales");
        assertThat(result.size()).isEqualTo(2);
        assertThat((Double) result.value(0, "2024-01_sales")).isCloseTo(100.0 / 220.0,
                offset(1e-12));
        assertThat(result.value(1, "2024-01_sales")).isEqualTo(1.0);
    }

    @Test
    void pivotRejectsOverlappingDimensions() {
        assertThatThrownBy(() -> engine.pivot(rows, List.of(region), List.of(region), List.of(sales), null))
                .isInstanceOf(InvalidArgumentException.class);
    }
}
