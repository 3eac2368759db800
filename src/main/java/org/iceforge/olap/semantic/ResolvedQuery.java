package org.iceforge.olap.semantic;

import org.iceforge.olap.data.ColumnKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of name resolution: the requested logical fields bound to input column positions, in request order.
 */
public record ResolvedQuery(Dataset dataset, List<FieldRef> dimensions, List<MeasureRef> measures) {

    public ResolvedQuery {
        Objects.requireNonNull(dataset, "dataset");
        dimensions = List.copyOf(dimensions);
        measures = List.copyOf(measures);
    }

    public FieldRef dimension(String name) {
        for (FieldRef f : dimensions) {
            if (f.name().equals(name)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Dimension '" + name + "' was not part of the resolved query");
    }

    public List<FieldRef> dimensions(List<String> names) {
        List<FieldRef> out = new ArrayList<>(names.size());
        for (String n : names) {
            out.add(dimension(n));
        }
        return out;
    }

    /**
     * Measures seen as raw numeric input columns, as the statistics engine consumes them.
     */
    public List<FieldRef> measureColumns() {
        List<FieldRef> out = new ArrayList<>(measures.size());
        for (MeasureRef m : measures) {
            out.add(new FieldRef(m.name(), m.index(), ColumnKind.NUMBER));
        }
        return out;
    }
}
