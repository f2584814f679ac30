package com.lintsentinel.rules.typescript;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;
import com.lintsentinel.rules.RuleOptions;

import java.util.Objects;
import java.util.Optional;

/**
 * Disallows the {@code any} type.
 *
 * <p>
 * Configured under {@code @typescript-eslint/no-explicit-any}; the scope is
 * folded into the {@code typescript} category.
 * </p>
 */
public final class NoExplicitAny extends BaseRule {

    public static final String NAME = "no-explicit-any";

    record Options(
            @JsonProperty("fixToUnknown") boolean fixToUnknown,
            @JsonProperty("ignoreRestArgs") boolean ignoreRestArgs) {
    }

    private static final Options DEFAULTS = new Options(false, false);

    private final Options options;

    private NoExplicitAny(Options options) {
        super("typescript", NAME);
        this.options = options;
    }

    public static NoExplicitAny fromConfig(Optional<JsonNode> config) {
        return new NoExplicitAny(RuleOptions.bind(config, Options.class, DEFAULTS));
    }

    public boolean isFixToUnknown() {
        return options.fixToUnknown();
    }

    public boolean isIgnoreRestArgs() {
        return options.ignoreRestArgs();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NoExplicitAny that))
            return false;
        return options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, options);
    }
}
