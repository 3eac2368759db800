package org.iceforge.olap.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.olap.config.AppConfig;
import org.iceforge.olap.data.Column;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.error.AmbiguousJoinException;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.error.UnknownFieldException;
import org.iceforge.olap.model.SemanticModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldResolverTest {

    private final FieldResolver resolver = new FieldResolver();

    private Dataset sales;

    private final List<Column> columns = List.of(
            new Column("order_id", ColumnKind.NUMBER),
            new Column("customers.region", ColumnKind.STRING),
            new Column("amount", ColumnKind.NUMBER),
            new Column("cat", ColumnKind.STRING),
            new Column("note", ColumnKind.STRING),
            new Column("supplier", ColumnKind.STRING),
            new Column("country", ColumnKind.STRING));

    @BeforeEach
    void compile() throws Exception {
        ObjectMapper yaml = new AppConfig().yamlObjectMapper();
        SemanticModel model = yaml.readValue("""
                datasets:
                  sales:
                    baseTable: orders
                    joins:
                      - left: orders
                        right: customers
                        on: [{left: customer_id, right: id}]
                      - left: orders
                        right: stores
                        on: [{left: store_id, right: id}]
                      - left: customers
                        right: countries
                        on: [{left: country_id, right: id}]
                      - left: stores
                        right: countries
                        on: [{left: country_id, right: id}]
                    dimensions:
                      region:
                        table: customers
                      category:
                        column: cat
                      remark:
                        column: note
                      supplier:
                        table: suppliers
                      country:
                        table: countries
                    measures:
                      revenue:
                        column: amount
                        aggregation: sum
                      orders:
                        column: order_id
                        aggregation: count
                      bad_total:
                        column: note
                        aggregation: sum
                    hierarchies:
                      geo: [region, category]
                """, SemanticModel.class);
        sales = new SemanticModelCompiler().compile(model).dataset("sales");
    }

    @Test
    void resolvesByNameColumnAndQualifiedColumn() {
        ResolvedQuery q = resolver.resolve(sales, columns, List.of("category", "region"), List.of("revenue", "orders"));

        assertThat(q.dimensions()).containsExactly(
                new FieldRef("category", 3, ColumnKind.STRING),
                new FieldRef("region", 1, ColumnKind.STRING));
        assertThat(q.measures()).containsExactly(
                new MeasureRef("revenue", 2, AggregationFunction.SUM),
                new MeasureRef("orders", 0, AggregationFunction.COUNT));
        assertThat(q.dimension("region").index()).isEqualTo(1);
        assertThat(q.measureColumns().get(0).kind()).isEqualTo(ColumnKind.NUMBER);
    }

    @Test
    void unknownNamesAreReported() {
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of("city"), List.of()))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("city");
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of(), List.of("profit")))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("profit");
    }

    @Test
    void declaredFieldMissingFromInput() {
        List<Column> narrow = List.of(new Column("amount", ColumnKind.NUMBER));

        assertThatThrownBy(() -> resolver.resolve(sales, narrow, List.of("category"), List.of()))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("not present in the input");
    }

    @Test
    void repeatedFieldIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of("region", "region"), List.of()))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void sumOverTextColumnIsMalformed() {
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of(), List.of("bad_total")))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("bad_total");
    }

    @Test
    void tableWithoutJoinPathIsAmbiguous() {
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of("supplier"), List.of()))
                .isInstanceOf(AmbiguousJoinException.class)
                .hasMessageContaining("does not join");
    }

    @Test
    void tableReachedThroughTwoPathsIsAmbiguous() {
        assertThatThrownBy(() -> resolver.resolve(sales, columns, List.of("country"), List.of()))
                .isInstanceOf(AmbiguousJoinException.class)
                .hasMessageContaining("2 join paths");
    }

    @Test
    void resolveFieldAcceptsDimensionsAndMeasures() {
        assertThat(resolver.resolveField(sales, columns, "remark")).isEqualTo(new FieldRef("remark", 4, ColumnKind.STRING));
        assertThat(resolver.resolveField(sales, columns, "revenue")).isEqualTo(new FieldRef("revenue", 2, ColumnKind.NUMBER));
        assertThatThrownBy(() -> resolver.resolveField(sales, columns, "nope"))
                .isInstanceOf(UnknownFieldException.class);
    }

    @Test
    void expandsHierarchies() {
        assertThat(resolver.expandHierarchy(sales, "geo", null)).containsExactly("region", "category");
        assertThat(resolver.expandHierarchy(sales, "geo", "region")).containsExactly("region");
        assertThat(sales.hierarchy("geo").orElseThrow().drillDown("region")).contains("category");
        assertThat(sales.hierarchy("geo").orElseThrow().drillDown("category")).isEmpty();
        assertThatThrownBy(() -> resolver.expandHierarchy(sales, "geo", "store"))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> resolver.expandHierarchy(sales, "calendar", null))
                .isInstanceOf(UnknownFieldException.class);
    }
}
