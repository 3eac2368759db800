package org.iceforge.olap.error;

import java.util.List;

/**
 * The semantic model failed validation. Carries every problem found, the model is never published.
 */
public class ConfigurationException extends OlapException {

    private final List<String> errors;

    public ConfigurationException(List<String> errors) {
        super("Semantic model is invalid: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
