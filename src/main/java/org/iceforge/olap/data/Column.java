package org.iceforge.olap.data;

import java.util.Objects;

public record Column(String name, ColumnKind kind) {

    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
