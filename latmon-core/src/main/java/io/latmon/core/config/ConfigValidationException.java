package io.latmon.core.config;

import java.util.List;

public final class ConfigValidationException extends RuntimeException {
    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
