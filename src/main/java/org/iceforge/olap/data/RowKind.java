package org.iceforge.olap.data;

public enum RowKind {
    DETAIL,
    SUBTOTAL,
    GRAND_TOTAL,
    /** Time bucket produced by the date spine with no input rows behind it. */
    FILLED
}
