package org.iceforge.olap.service;

import org.iceforge.olap.error.ConfigurationException;
import org.iceforge.olap.model.SemanticModel;
import org.iceforge.olap.semantic.Dataset;
import org.iceforge.olap.semantic.SemanticModelCompiler;
import org.iceforge.olap.semantic.SemanticModelSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published semantic model. Publishing swaps the whole snapshot reference; a snapshot is never modified,
 * so requests that already hold one keep computing against it.
 */
@Component
public class SemanticModelRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticModelRegistry.class);

    private final SemanticModelLoader loader;
    private final SemanticModelCompiler compiler;

    private final AtomicReference<SemanticModelSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public SemanticModelRegistry(SemanticModelLoader loader, SemanticModelCompiler compiler) {
        this.loader = Objects.requireNonNull(loader);
        this.compiler = Objects.requireNonNull(compiler);
    }

    /**
     * The snapshot requests should use, loading the configured model on first access.
     */
    public SemanticModelSnapshot current() {
        SemanticModelSnapshot local = current.get();
        if (local != null) return local;

        synchronized (this) {
            if (current.get() != null) return current.get();
            return publish(loader.load());
        }
    }

    public Dataset dataset(String name) {
        return current().dataset(name);
    }

    /**
     * Re-reads the configured model and swaps it in. On failure the previous snapshot stays published.
     *
     * @throws ConfigurationException when the new model does not load or validate
     */
    public synchronized SemanticModelSnapshot reload() {
        try {
            return publish(loader.load());
        } catch (ConfigurationException e) {
            LOGGER.warn("Semantic model reload rejected, keeping version {}: {}", versionOrNone(), e.getErrors());
            throw e;
        }
    }

    /**
     * Compiles and publishes a model supplied programmatically.
     */
    public synchronized SemanticModelSnapshot publish(SemanticModel model) {
        return publish(compiler.compile(model));
    }

    private SemanticModelSnapshot publish(SemanticModelSnapshot compiled) {
        SemanticModelSnapshot versioned = compiled.withVersion(versions.incrementAndGet());
        SemanticModelSnapshot previous = current.getAndSet(versioned);
        LOGGER.info("Published semantic model version {} (previous {}), datasets {}", versioned.getVersion(),
                previous == null ? "none" : previous.getVersion(), versioned.getDatasets().keySet());
        return versioned;
    }

    private String versionOrNone() {
        SemanticModelSnapshot s = current.get();
        return s == null ? "none" : String.valueOf(s.getVersion());
    }
}
