package com.lintsentinel.rules.eslint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;
import com.lintsentinel.rules.RuleOptions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Disallows calls to {@code console} methods, except those listed in
 * {@code allow}.
 *
 * <pre>
 * "no-console": ["warn", { "allow": ["warn", "error"] }]
 * </pre>
 */
public final class NoConsole extends BaseRule {

    public static final String NAME = "no-console";

    record Options(@JsonProperty("allow") List<String> allow) {
        Options {
            allow = allow != null ? List.copyOf(allow) : List.of();
        }
    }

    private static final Options DEFAULTS = new Options(List.of());

    private final List<String> allow;

    private NoConsole(Options options) {
        super("eslint", NAME);
        this.allow = options.allow();
    }

    public static NoConsole fromConfig(Optional<JsonNode> config) {
        return new NoConsole(RuleOptions.bind(config, Options.class, DEFAULTS));
    }

    /**
     * @return console methods that may still be called
     */
    public List<String> getAllow() {
        return allow;
    }

    public boolean isAllowed(String method) {
        return allow.contains(method);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NoConsole that))
            return false;
        return allow.equals(that.allow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, allow);
    }
}
