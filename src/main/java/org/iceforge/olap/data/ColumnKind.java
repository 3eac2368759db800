package org.iceforge.olap.data;

/**
 * Declared kind of an input or output column.
 */
public enum ColumnKind {
    STRING,
    NUMBER,
    BOOLEAN,
    TIMESTAMP,
    NULL;

    /**
     * Whether a non-null value may be stored in a column of this kind. Timestamp columns take the date and time
     * types {@link CellValues#toTimestamp} reads, plus ISO-8601 strings parsed when a time grain is applied. Times
     * of day and other temporals without a date are rejected.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case TIMESTAMP -> CellValues.isTimestamp(value) || value instanceof String;
            case NULL -> false;
        };
    }
}
