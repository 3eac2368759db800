package org.iceforge.olap.data;

/**
 * Where NULL sorts relative to non-null values in group keys and window ordering.
 */
public enum NullOrdering {
    FIRST,
    LAST
}
