package org.iceforge.olap.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative semantic model as read from YAML. Validated and turned into immutable datasets by
 * {@link org.iceforge.olap.semantic.SemanticModelCompiler}.
 */
public class SemanticModel {
    private Map<String, DatasetDef> datasets = new LinkedHashMap<>();

    public Map<String, DatasetDef> getDatasets() {
        return datasets;
    }

    public void setDatasets(Map<String, DatasetDef> datasets) {
        this.datasets = datasets;
    }
}
