package org.iceforge.olap.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One output row. Cells may be null, which is the engine's absent marker.
 */
public record ResultRow(List<Object> cells, RowGroup group) {

    public ResultRow {
        Objects.requireNonNull(cells, "cells");
        cells = Collections.unmodifiableList(new ArrayList<>(cells));
        group = group == null ? RowGroup.DETAIL : group;
    }

    public Object get(int index) {
        return cells.get(index);
    }
}
