package org.iceforge.olap.engine.aggregate;

import java.util.Locale;
import java.util.Optional;

/**
 * Denominator a pivot cell is re-expressed against.
 */
public enum PercentageOf {
    ROW,
    COLUMN,
    GRAND_TOTAL;

    public static Optional<PercentageOf> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("TOTAL")) {
            normalized = "GRAND_TOTAL";
        }
        for (PercentageOf p : values()) {
            if (p.name().equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
