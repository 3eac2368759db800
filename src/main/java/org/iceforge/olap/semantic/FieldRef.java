package org.iceforge.olap.semantic;

import org.iceforge.olap.data.ColumnKind;

import java.util.Objects;

/**
 * A logical field bound to a physical column position of the flat input.
 */
public record FieldRef(String name, int index, ColumnKind kind) {

    public FieldRef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
