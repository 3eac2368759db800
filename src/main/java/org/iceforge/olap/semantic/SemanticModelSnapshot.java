package org.iceforge.olap.semantic;

import org.iceforge.olap.error.UnknownFieldException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One published version of the semantic model. Requests hold on to the snapshot they started with, so a reload
 * never changes a dataset underneath an in-flight computation.
 */
public final class SemanticModelSnapshot {

    private final long version;
    private final Instant publishedAt;
    private final Map<String, Dataset> datasets;

    public SemanticModelSnapshot(long version, Instant publishedAt, Map<String, Dataset> datasets) {
        this.version = version;
        this.publishedAt = publishedAt;
        this.datasets = Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    public long getVersion() {
        return version;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Map<String, Dataset> getDatasets() {
        return datasets;
    }

    public Dataset dataset(String name) {
        Dataset ds = datasets.get(name);
        if (ds == null) {
            throw new UnknownFieldException("Unknown dataset: " + name + ". Available: " + datasets.keySet());
        }
        return ds;
    }

    public SemanticModelSnapshot withVersion(long newVersion) {
        return new SemanticModelSnapshot(newVersion, publishedAt, datasets);
    }
}
