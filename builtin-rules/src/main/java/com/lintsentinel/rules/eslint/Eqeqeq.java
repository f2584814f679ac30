package com.lintsentinel.rules.eslint;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;

import java.util.Optional;

/**
 * Requires {@code ===} and {@code !==}.
 *
 * <p>
 * The option is a string: {@code "always"} (default) or {@code "smart"},
 * which tolerates comparisons against literals, {@code typeof} and
 * {@code null}.
 * </p>
 */
public final class Eqeqeq extends BaseRule {

    public static final String NAME = "eqeqeq";

    public enum Mode {
        ALWAYS,
        SMART
    }

    private final Mode mode;

    private Eqeqeq(Mode mode) {
        super("eslint", NAME);
        this.mode = mode;
    }

    public static Eqeqeq fromConfig(Optional<JsonNode> config) {
        if (config.isEmpty() || config.get().isNull()) {
            return new Eqeqeq(Mode.ALWAYS);
        }
        JsonNode value = config.get();
        String mode = value.isTextual() ? value.textValue() : "";
        return switch (mode) {
            case "always" -> new Eqeqeq(Mode.ALWAYS);
            case "smart" -> new Eqeqeq(Mode.SMART);
            default -> throw new IllegalArgumentException(
                    "Expected \"always\" or \"smart\" but got " + value);
        };
    }

    public Mode getMode() {
        return mode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Eqeqeq that))
            return false;
        return mode == that.mode;
    }

    @Override
    public int hashCode() {
        return mode.hashCode();
    }
}
