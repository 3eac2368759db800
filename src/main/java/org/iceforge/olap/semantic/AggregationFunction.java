package org.iceforge.olap.semantic;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of measure aggregation functions.
 */
public enum AggregationFunction {
    SUM,
    COUNT,
    COUNT_DISTINCT,
    AVG,
    MIN,
    MAX;

    public static Optional<AggregationFunction> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("AVERAGE") || normalized.equals("MEAN")) {
            normalized = "AVG";
        }
        for (AggregationFunction f : values()) {
            if (f.name().equals(normalized)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
