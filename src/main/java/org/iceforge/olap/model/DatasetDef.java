package org.iceforge.olap.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DatasetDef {
    private String description;
    private String baseTable;
    private List<JoinDef> joins = new ArrayList<>();
    private Map<String, DimensionDef> dimensions = new LinkedHashMap<>(); // logical name -> definition
    private Map<String, MeasureDef> measures = new LinkedHashMap<>();
    private Map<String, List<String>> hierarchies = new LinkedHashMap<>(); // name -> levels, coarsest first
    private TimeDimensionDef timeDimension;

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getBaseTable() {
        return baseTable;
    }

    public void setBaseTable(String baseTable) {
        this.baseTable = baseTable;
    }

    public List<JoinDef> getJoins() {
        return joins;
    }

    public void setJoins(List<JoinDef> joins) {
        this.joins = joins;
    }

    public Map<String, DimensionDef> getDimensions() {
        return dimensions;
    }

    public void setDimensions(Map<String, DimensionDef> dimensions) {
        this.dimensions = dimensions;
    }

    public Map<String, MeasureDef> getMeasures() {
        return measures;
    }

    public void setMeasures(Map<String, MeasureDef> measures) {
        this.measures = measures;
    }

    public Map<String, List<String>> getHierarchies() {
        return hierarchies;
    }

    public void setHierarchies(Map<String, List<String>> hierarchies) {
        this.hierarchies = hierarchies;
    }

    public TimeDimensionDef getTimeDimension() {
        return timeDimension;
    }

    public void setTimeDimension(TimeDimensionDef timeDimension) {
        this.timeDimension = timeDimension;
    }
}
