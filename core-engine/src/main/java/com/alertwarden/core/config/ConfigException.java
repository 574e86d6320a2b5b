package com.alertwarden.core.config;

import java.util.Collections;
import java.util.List;

/**
 * The alerting configuration document was rejected.
 *
 * <p>
 * Carries every problem found, not just the first one. A rejected document
 * activates nothing: the engine keeps running on its previous configuration
 * (or none).
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ConfigException(List<String> errors) {
        super("Alerting configuration rejected:\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigException(String error, Throwable cause) {
        super("Alerting configuration rejected:\n  - " + error, cause);
        this.errors = Collections.singletonList(error);
    }

    /**
     * @return unmodifiable list of validation errors
     */
    public List<String> getErrors() {
        return errors;
    }
}
