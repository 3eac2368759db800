package org.iceforge.olap.semantic;

import java.util.Objects;

/**
 * Published dimension. {@code grain} is only set for temporal dimensions that declare one.
 */
public record Dimension(String name, String column, String table, DimensionKind kind, TimeGrain grain,
                        String description) {

    public Dimension {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(kind, "kind");
    }
}
