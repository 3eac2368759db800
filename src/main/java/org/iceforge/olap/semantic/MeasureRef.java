package org.iceforge.olap.semantic;

import java.util.Objects;

/**
 * A measure bound to its input column together with the aggregation it is declared with.
 */
public record MeasureRef(String name, int index, AggregationFunction function) {

    public MeasureRef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
    }
}
