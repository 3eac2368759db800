package org.iceforge.olap.semantic;

import java.util.List;
import java.util.Objects;

public record Join(String left, String right, JoinKind kind, List<Condition> conditions) {

    public Join {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(kind, "kind");
        conditions = List.copyOf(conditions);
    }

    public record Condition(String leftColumn, String rightColumn) {
    }
}
