package org.iceforge.olap.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.olap.config.OlapProperties;
import org.iceforge.olap.error.ConfigurationException;
import org.iceforge.olap.model.SemanticModel;
import org.iceforge.olap.semantic.SemanticModelCompiler;
import org.iceforge.olap.semantic.SemanticModelSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads the semantic model YAML and compiles it. Never publishes anything itself, see
 * {@link SemanticModelRegistry}.
 */
@Component
public class SemanticModelLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticModelLoader.class);

    private final ObjectMapper yamlMapper;
    private final OlapProperties props;
    private final SemanticModelCompiler compiler;

    public SemanticModelLoader(ObjectMapper yamlObjectMapper, OlapProperties props, SemanticModelCompiler compiler) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
        this.props = Objects.requireNonNull(props);
        this.compiler = Objects.requireNonNull(compiler);
    }

    public SemanticModelSnapshot load() {
        Resource resource = modelResource();
        try (InputStream in = resource.getInputStream()) {
            SemanticModel model = read(in);
            SemanticModelSnapshot snapshot = compiler.compile(model);
            LOGGER.info("Compiled semantic model from {}: datasets {}", resource.getDescription(),
                    snapshot.getDatasets().keySet());
            return snapshot;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load semantic model resource: " + resource.getDescription(), e);
        }
    }

    public SemanticModel read(InputStream in) throws IOException {
        SemanticModel model = yamlMapper.readValue(in, SemanticModel.class);
        return model == null ? new SemanticModel() : model;
    }

    private Resource modelResource() {
        if (StringUtils.hasText(props.getModelLocation())) {
            return new FileSystemResource(props.getModelLocation());
        }
        return new ClassPathResource(props.getModelResource());
    }
}
