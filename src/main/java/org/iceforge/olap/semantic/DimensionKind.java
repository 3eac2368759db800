package org.iceforge.olap.semantic;

import java.util.Locale;
import java.util.Optional;

public enum DimensionKind {
    CATEGORICAL,
    NUMERIC,
    TEMPORAL;

    public static Optional<DimensionKind> parse(String name) {
        if (name == null) {
            return Optional.of(CATEGORICAL);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("STANDARD")) {
            return Optional.of(CATEGORICAL);
        }
        if (normalized.equals("TIME")) {
            return Optional.of(TEMPORAL);
        }
        for (DimensionKind k : values()) {
            if (k.name().equals(normalized)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
