package org.iceforge.olap.engine.window;

import java.util.Locale;
import java.util.Optional;

/**
 * Catalogue of window computations. Ranking functions work on the order keys only; all others read a value field.
 */
public enum WindowFunction {
    RUNNING_TOTAL,
    RUNNING_AVG,
    RUNNING_COUNT,
    RUNNING_MIN,
    RUNNING_MAX,
    MOVING_AVG,
    MOVING_SUM,
    RANK,
    DENSE_RANK,
    ROW_NUMBER,
    NTILE,
    PERCENT_RANK,
    CUME_DIST,
    PERCENT_OF_TOTAL,
    PERCENT_CHANGE,
    LAG,
    LEAD,
    FIRST_VALUE,
    LAST_VALUE,
    DIFFERENCE_FROM_PREVIOUS,
    DIFFERENCE_FROM_FIRST,
    DIFFERENCE_FROM_AVERAGE;

    public static Optional<WindowFunction> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (WindowFunction f : values()) {
            if (f.name().equals(normalized)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    public boolean isRanking() {
        return switch (this) {
            case RANK, DENSE_RANK, ROW_NUMBER, NTILE, PERCENT_RANK, CUME_DIST -> true;
            default -> false;
        };
    }

    /**
     * Ranking functions other than ROW_NUMBER are meaningless without an order.
     */
    public boolean requiresOrder() {
        return isRanking() && this != ROW_NUMBER;
    }

    public boolean requiresValue() {
        return !isRanking();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
