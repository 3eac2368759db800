package org.iceforge.olap.data;

public enum ColumnRole {
    DIMENSION,
    MEASURE,
    DERIVED,
    /**
     * Copied unchanged from raw input rows, which carry no dimension or measure tagging.
     */
    ATTRIBUTE
}
