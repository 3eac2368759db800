package org.iceforge.olap.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, immutable dataset. Created by {@link SemanticModelCompiler} and never mutated; a reload publishes
 * a new instance instead.
 */
public final class Dataset {

    private final String name;
    private final String description;
    private final String baseTable;
    private final List<Join> joins;
    private final Map<String, Dimension> dimensions;
    private final Map<String, Measure> measures;
    private final Map<String, Hierarchy> hierarchies;
    private final TimeDimension timeDimension;

    public Dataset(String name,
                   String description,
                   String baseTable,
                   List<Join> joins,
                   Map<String, Dimension> dimensions,
                   Map<String, Measure> measures,
                   Map<String, Hierarchy> hierarchies,
                   TimeDimension timeDimension) {
        this.name = Objects.requireNonNull(name);
        this.description = description;
        this.baseTable = Objects.requireNonNull(baseTable);
        this.joins = List.copyOf(joins);
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        this.measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
        this.hierarchies = Collections.unmodifiableMap(new LinkedHashMap<>(hierarchies));
        this.timeDimension = timeDimension;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getBaseTable() {
        return baseTable;
    }

    public List<Join> getJoins() {
        return joins;
    }

    public Map<String, Dimension> getDimensions() {
        return dimensions;
    }

    public Map<String, Measure> getMeasures() {
        return measures;
    }

    public Map<String, Hierarchy> getHierarchies() {
        return hierarchies;
    }

    public Optional<TimeDimension> getTimeDimension() {
        return Optional.ofNullable(timeDimension);
    }

    public Optional<Dimension> dimension(String name) {
        return Optional.ofNullable(dimensions.get(name));
    }

    public Optional<Measure> measure(String name) {
        return Optional.ofNullable(measures.get(name));
    }

    public Optional<Hierarchy> hierarchy(String name) {
        return Optional.ofNullable(hierarchies.get(name));
    }

    @Override
    public String toString() {
        return "Dataset[" + name + ", dimensions=" + dimensions.keySet() + ", measures=" + measures.keySet() + "]";
    }
}
