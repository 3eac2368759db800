package org.iceforge.olap.engine.window;

import org.iceforge.olap.semantic.FieldRef;

import java.util.Objects;

public record SortKey(FieldRef field, boolean descending) {

    public SortKey {
        Objects.requireNonNull(field, "field");
    }

    public static SortKey asc(FieldRef field) {
        return new SortKey(field, false);
    }

    public static SortKey desc(FieldRef field) {
        return new SortKey(field, true);
    }
}
