package org.iceforge.olap.semantic;

import org.iceforge.olap.error.ConfigurationException;
import org.iceforge.olap.model.DatasetDef;
import org.iceforge.olap.model.DimensionDef;
import org.iceforge.olap.model.JoinDef;
import org.iceforge.olap.model.MeasureDef;
import org.iceforge.olap.model.SemanticModel;
import org.iceforge.olap.model.TimeDimensionDef;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a declarative {@link SemanticModel} and turns it into immutable {@link Dataset}s. A model either
 * compiles completely or not at all.
 */
@Component
public class SemanticModelCompiler {

    /**
     * @return a snapshot with version 0; the registry assigns the published version
     * @throws ConfigurationException listing every problem found
     */
    public SemanticModelSnapshot compile(SemanticModel model) {
        List<String> errors = new ArrayList<>();
        Map<String, Dataset> datasets = compile(model, errors);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return new SemanticModelSnapshot(0L, Instant.now(), datasets);
    }

    public List<String> validate(SemanticModel model) {
        List<String> errors = new ArrayList<>();
        compile(model, errors);
        return errors;
    }

    private Map<String, Dataset> compile(SemanticModel model, List<String> errors) {
        Objects.requireNonNull(model);
        Map<String, Dataset> out = new LinkedHashMap<>();
        Map<String, DatasetDef> defs = model.getDatasets() == null ? Map.of() : model.getDatasets();

        for (Map.Entry<String, DatasetDef> e : defs.entrySet()) {
            int before = errors.size();
            Dataset ds = compileDataset(e.getKey(), e.getValue(), errors);
            if (errors.size() == before) {
                out.put(e.getKey(), ds);
            }
        }

        checkJoinGraphIsAcyclic(defs, errors);
        return out;
    }

    private Dataset compileDataset(String name, DatasetDef def, List<String> errors) {
        if (!StringUtils.hasText(name)) {
            errors.add("Dataset with blank name");
            return null;
        }
        if (def == null) {
            errors.add("Dataset '" + name + "' has no definition");
            return null;
        }
        if (!StringUtils.hasText(def.getBaseTable())) {
            errors.add("Dataset '" + name + "' has no baseTable");
            return null;
        }
        String base = def.getBaseTable();

        Map<String, Dimension> dimensions = new LinkedHashMap<>();
        Map<String, DimensionDef> dimDefs = def.getDimensions() == null ? Map.of() : def.getDimensions();
        for (Map.Entry<String, DimensionDef> d : dimDefs.entrySet()) {
            Dimension dim = compileDimension(name, base, d.getKey(), d.getValue(), errors);
            if (dim != null) {
                dimensions.put(dim.name(), dim);
            }
        }

        Map<String, Measure> measures = new LinkedHashMap<>();
        Map<String, MeasureDef> measureDefs = def.getMeasures() == null ? Map.of() : def.getMeasures();
        for (Map.Entry<String, MeasureDef> m : measureDefs.entrySet()) {
            if (dimDefs.containsKey(m.getKey())) {
                errors.add("Dataset '" + name + "': measure '" + m.getKey() + "' collides with a dimension name");
                continue;
            }
            Measure measure = compileMeasure(name, base, m.getKey(), m.getValue(), errors);
            if (measure != null) {
                measures.put(measure.name(), measure);
            }
        }

        Map<String, Hierarchy> hierarchies = new LinkedHashMap<>();
        Map<String, List<String>> hierarchyDefs = def.getHierarchies() == null ? Map.of() : def.getHierarchies();
        for (Map.Entry<String, List<String>> h : hierarchyDefs.entrySet()) {
            Hierarchy hierarchy = compileHierarchy(name, h.getKey(), h.getValue(), dimDefs.keySet(), dimensions,
                    errors);
            if (hierarchy != null) {
                hierarchies.put(hierarchy.name(), hierarchy);
            }
        }

        List<Join> joins = new ArrayList<>();
        List<JoinDef> joinDefs = def.getJoins() == null ? List.of() : def.getJoins();
        for (int i = 0; i < joinDefs.size(); i++) {
            Join join = compileJoin(name, i, joinDefs.get(i), errors);
            if (join != null) {
                joins.add(join);
            }
        }
        checkJoinsRooted(name, base, joins, errors);

        TimeDimension timeDimension = compileTimeDimension(name, def.getTimeDimension(), dimensions, errors);

        return new Dataset(name, def.getDescription(), base, joins, dimensions, measures, hierarchies, timeDimension);
    }

    private Dimension compileDimension(String ds, String base, String name, DimensionDef def, List<String> errors) {
        if (!StringUtils.hasText(name)) {
            errors.add("Dataset '" + ds + "': dimension with blank name");
            return null;
        }
        DimensionDef d = def == null ? new DimensionDef() : def;
        DimensionKind kind = DimensionKind.parse(d.getKind()).orElse(null);
        if (kind == null) {
            errors.add("Dataset '" + ds + "': dimension '" + name + "' has unknown kind '" + d.getKind() + "'");
            return null;
        }
        TimeGrain grain = null;
        if (StringUtils.hasText(d.getGrain())) {
            if (kind != DimensionKind.TEMPORAL) {
                errors.add("Dataset '" + ds + "': dimension '" + name + "' declares a grain but is not temporal");
                return null;
            }
            grain = TimeGrain.parse(d.getGrain()).orElse(null);
            if (grain == null) {
                errors.add("Dataset '" + ds + "': dimension '" + name + "' has unknown grain '" + d.getGrain() + "'");
                return null;
            }
        }
        String column = StringUtils.hasText(d.getColumn()) ? d.getColumn() : name;
        String table = StringUtils.hasText(d.getTable()) ? d.getTable() : base;
        return new Dimension(name, column, table, kind, grain, d.getDescription());
    }

    private Measure compileMeasure(String ds, String base, String name, MeasureDef def, List<String> errors) {
        if (!StringUtils.hasText(name)) {
            errors.add("Dataset '" + ds + "': measure with blank name");
            return null;
        }
        if (def == null || !StringUtils.hasText(def.getAggregation())) {
            errors.add("Dataset '" + ds + "': measure '" + name + "' declares no aggregation function");
            return null;
        }
        AggregationFunction fn = AggregationFunction.parse(def.getAggregation()).orElse(null);
        if (fn == null) {
            errors.add("Dataset '" + ds + "': measure '" + name + "' uses unknown aggregation function '"
                    + def.getAggregation() + "'");
            return null;
        }
        String column = StringUtils.hasText(def.getColumn()) ? def.getColumn() : name;
        String table = StringUtils.hasText(def.getTable()) ? def.getTable() : base;
        return new Measure(name, column, table, fn, def.getFormat(), def.getDescription());
    }

    private Hierarchy compileHierarchy(String ds, String name, List<String> levels, Set<String> declared,
                                       Map<String, Dimension> dimensions, List<String> errors) {
        if (levels == null || levels.isEmpty()) {
            errors.add("Dataset '" + ds + "': hierarchy '" + name + "' has no levels");
            return null;
        }
        boolean ok = true;
        Set<String> seen = new HashSet<>();
        TimeGrain previous = null;
        for (String level : levels) {
            if (!declared.contains(level)) {
                errors.add("Dataset '" + ds + "': hierarchy '" + name + "' level '" + level
                        + "' is not a declared dimension");
                ok = false;
                continue;
            }
            if (!seen.add(level)) {
                errors.add("Dataset '" + ds + "': hierarchy '" + name + "' repeats level '" + level + "'");
                ok = false;
                continue;
            }
            Dimension dim = dimensions.get(level);
            if (dim != null && dim.grain() != null) {
                if (previous != null && !previous.isCoarserThan(dim.grain())) {
                    errors.add("Dataset '" + ds + "': hierarchy '" + name + "' level '" + level + "' ("
                            + dim.grain().label() + ") is not finer than the level above it (" + previous.label() + ")");
                    ok = false;
                }
                previous = dim.grain();
            }
        }
        return ok ? new Hierarchy(name, levels) : null;
    }

    private Join compileJoin(String ds, int i, JoinDef def, List<String> errors) {
        String where = "Dataset '" + ds + "': join #" + i;
        if (def == null || !StringUtils.hasText(def.getLeft()) || !StringUtils.hasText(def.getRight())) {
            errors.add(where + " needs both left and right tables");
            return null;
        }
        JoinKind kind = JoinKind.parse(def.getKind()).orElse(null);
        if (kind == null) {
            errors.add(where + " has unsupported kind '" + def.getKind() + "' (inner or left)");
            return null;
        }
        if (def.getOn() == null || def.getOn().isEmpty()) {
            errors.add(where + " (" + def.getLeft() + " -> " + def.getRight() + ") has no equality conditions");
            return null;
        }
        List<Join.Condition> conditions = new ArrayList<>();
        for (JoinDef.Condition c : def.getOn()) {
            if (c == null || !StringUtils.hasText(c.getLeft()) || !StringUtils.hasText(c.getRight())) {
                errors.add(where + " has an incomplete equality condition");
                return null;
            }
            conditions.add(new Join.Condition(c.getLeft(), c.getRight()));
        }
        return new Join(def.getLeft(), def.getRight(), kind, conditions);
    }

    private void checkJoinsRooted(String ds, String base, List<Join> joins, List<String> errors) {
        Set<String> reachable = new HashSet<>();
        reachable.add(base);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Join j : joins) {
                if (reachable.contains(j.left()) && reachable.add(j.right())) {
                    grew = true;
                }
            }
        }
        for (Join j : joins) {
            if (!reachable.contains(j.left())) {
                errors.add("Dataset '" + ds + "': join " + j.left() + " -> " + j.right()
                        + " is not reachable from base table '" + base + "'");
            }
        }
    }

    private TimeDimension compileTimeDimension(String ds, TimeDimensionDef def, Map<String, Dimension> dimensions,
                                               List<String> errors) {
        if (def == null) {
            return null;
        }
        Dimension dim = dimensions.get(def.getDimension());
        if (dim == null) {
            errors.add("Dataset '" + ds + "': time dimension '" + def.getDimension() + "' is not a declared dimension");
            return null;
        }
        if (dim.kind() != DimensionKind.TEMPORAL) {
            errors.add("Dataset '" + ds + "': time dimension '" + def.getDimension() + "' is not temporal");
            return null;
        }
        List<TimeGrain> grains = new ArrayList<>();
        for (String g : def.getGrains() == null ? List.<String>of() : def.getGrains()) {
            TimeGrain grain = TimeGrain.parse(g).orElse(null);
            if (grain == null) {
                errors.add("Dataset '" + ds + "': time dimension grain '" + g + "' is not one of year, quarter, "
                        + "month, week, day, hour");
                return null;
            }
            if (dim.grain() != null && dim.grain().isCoarserThan(grain)) {
                errors.add("Dataset '" + ds + "': time dimension grain '" + g + "' is finer than the recorded grain '"
                        + dim.grain().label() + "' of '" + dim.name() + "'");
                return null;
            }
            grains.add(grain);
        }
        return new TimeDimension(dim.name(), grains);
    }

    /**
     * All joins of all datasets together must form a DAG.
     */
    private void checkJoinGraphIsAcyclic(Map<String, DatasetDef> defs, List<String> errors) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (DatasetDef def : defs.values()) {
            if (def == null || def.getJoins() == null) {
                continue;
            }
            for (JoinDef j : def.getJoins()) {
                if (j != null && StringUtils.hasText(j.getLeft()) && StringUtils.hasText(j.getRight())) {
                    edges.computeIfAbsent(j.getLeft(), k -> new LinkedHashSet<>()).add(j.getRight());
                }
            }
        }

        Set<String> done = new HashSet<>();
        for (String start : edges.keySet()) {
            List<String> cycle = findCycle(start, edges, done, new ArrayDeque<>(), new HashSet<>());
            if (cycle != null) {
                errors.add("Join graph contains a cycle: " + String.join(" -> ", cycle));
                return;
            }
        }
    }

    private List<String> findCycle(String node, Map<String, Set<String>> edges, Set<String> done,
                                   Deque<String> path, Set<String> onPath) {
        if (done.contains(node)) {
            return null;
        }
        if (onPath.contains(node)) {
            List<String> cycle = new ArrayList<>();
            boolean in = false;
            for (String p : path) {
                if (p.equals(node)) {
                    in = true;
                }
                if (in) {
                    cycle.add(p);
                }
            }
            cycle.add(node);
            return cycle;
        }
        path.addLast(node);
        onPath.add(node);
        for (String next : edges.getOrDefault(node, Set.of())) {
            List<String> cycle = findCycle(next, edges, done, path, onPath);
            if (cycle != null) {
                return cycle;
            }
        }
        path.removeLast();
        onPath.remove(node);
        done.add(node);
        return null;
    }
}
