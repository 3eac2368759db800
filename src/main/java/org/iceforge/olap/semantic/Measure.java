package org.iceforge.olap.semantic;

import java.util.Objects;

public record Measure(String name, String column, String table, AggregationFunction aggregation, String format,
                      String description) {

    public Measure {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(aggregation, "aggregation");
    }
}
