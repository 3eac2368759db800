package org.iceforge.olap.engine.filter;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison applied by a {@link RowFilter}. Besides the names, the SQL spellings ({@code >=}, {@code <>},
 * {@code not in}, {@code is null}) are accepted.
 */
public enum FilterOperator {
    EQ("="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    IN("in"),
    NOT_IN("not in"),
    BETWEEN("between"),
    IS_NULL("is null"),
    IS_NOT_NULL("is not null");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<FilterOperator> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        switch (normalized) {
            case "==":
                return Optional.of(EQ);
            case "<>":
                return Optional.of(NE);
            default:
                break;
        }
        for (FilterOperator op : values()) {
            if (op.symbol.equals(normalized) || op.name().equalsIgnoreCase(normalized.replace(' ', '_'))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of operands the operator takes; -1 for a non-empty list of any length.
     */
    int arity() {
        return switch (this) {
            case IS_NULL, IS_NOT_NULL -> 0;
            case BETWEEN -> 2;
            case IN, NOT_IN -> -1;
            default -> 1;
        };
    }
}
