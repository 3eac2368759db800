package org.iceforge.olap.model;

import java.util.ArrayList;
import java.util.List;

public class TimeDimensionDef {
    private String dimension;
    private List<String> grains = new ArrayList<>();

    public String getDimension() {
        return dimension;
    }

    public void setDimension(String dimension) {
        this.dimension = dimension;
    }

    public List<String> getGrains() {
        return grains;
    }

    public void setGrains(List<String> grains) {
        this.grains = grains;
    }
}
