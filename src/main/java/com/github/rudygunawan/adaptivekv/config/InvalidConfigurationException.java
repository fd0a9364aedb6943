package com.github.rudygunawan.adaptivekv.config;

import java.util.List;

/**
 * Thrown when a {@link CacheConfiguration} has one or more out-of-range options.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("invalid cache configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns one message per rejected option.
     */
    public List<String> getViolations() {
        return violations;
    }
}
