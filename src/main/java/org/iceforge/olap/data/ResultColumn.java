package org.iceforge.olap.data;

import java.util.Objects;

public record ResultColumn(String name, ColumnRole role, ColumnKind kind) {

    public ResultColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(kind, "kind");
    }

    public static ResultColumn dimension(String name, ColumnKind kind) {
        return new ResultColumn(name, ColumnRole.DIMENSION, kind);
    }

    public static ResultColumn measure(String name) {
        return new ResultColumn(name, ColumnRole.MEASURE, ColumnKind.NUMBER);
    }

    public static ResultColumn attribute(String name, ColumnKind kind) {
        return new ResultColumn(name, ColumnRole.ATTRIBUTE, kind);
    }

    public static ResultColumn derived(String name, ColumnKind kind) {
        return new ResultColumn(name, ColumnRole.DERIVED, kind);
    }
}
