package org.iceforge.olap.semantic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drill-down path, coarsest level first. Also the peel order of a rollup.
 */
public record Hierarchy(String name, List<String> levels) {

    public Hierarchy {
        Objects.requireNonNull(name, "name");
        levels = List.copyOf(levels);
    }

    public Optional<String> drillDown(String level) {
        int i = levels.indexOf(level);
        if (i < 0 || i == levels.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(levels.get(i + 1));
    }

    /**
     * Levels from the top of the hierarchy down to and including {@code level}.
     */
    public List<String> levelsThrough(String level) {
        int i = levels.indexOf(level);
        if (i < 0) {
            throw new IllegalArgumentException("Hierarchy '" + name + "' has no level '" + level + "'");
        }
        return levels.subList(0, i + 1);
    }
}
