package com.alertwarden.core.registry;

import java.util.List;

/**
 * An action group was rejected by the registry: malformed receiver, short name
 * collision or unknown escalation target.
 *
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public ValidationException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
