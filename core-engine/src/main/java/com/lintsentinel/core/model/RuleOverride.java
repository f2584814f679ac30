package com.lintsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Explicit entry from the {@code rules} object: a severity plus the optional
 * rule-specific configuration value (the second element of the array form).
 *
 * @since 1.0.0
 */
public final class RuleOverride {

    private final Severity severity;
    private final JsonNode config;

    private RuleOverride(Severity severity, JsonNode config) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.config = config;
    }

    public static RuleOverride of(Severity severity) {
        return new RuleOverride(severity, null);
    }

    public static RuleOverride of(Severity severity, JsonNode config) {
        return new RuleOverride(severity, config);
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return the rule-specific configuration, empty for the string form or a
     *         single-element array
     */
    public Optional<JsonNode> getConfig() {
        return Optional.ofNullable(config);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleOverride that))
            return false;
        return severity == that.severity && Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, config);
    }

    @Override
    public String toString() {
        return "RuleOverride{severity=" + severity + ", config=" + config + '}';
    }
}
