package com.lintsentinel.rules.eslint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;
import com.lintsentinel.rules.RuleOptions;

import java.util.Objects;
import java.util.Optional;

/**
 * Disallows unused variables.
 *
 * <p>
 * Accepts either a shorthand string for {@code vars} or an options object:
 * </p>
 *
 * <pre>
 * "no-unused-vars": ["error", "local"]
 * "no-unused-vars": ["error", { "vars": "all", "args": "none", "ignoreRestSiblings": true }]
 * </pre>
 */
public final class NoUnusedVars extends BaseRule {

    public static final String NAME = "no-unused-vars";

    public enum Vars {
        @JsonProperty("all")
        ALL,
        @JsonProperty("local")
        LOCAL
    }

    public enum Args {
        @JsonProperty("after-used")
        AFTER_USED,
        @JsonProperty("all")
        ALL,
        @JsonProperty("none")
        NONE
    }

    record Options(
            @JsonProperty("vars") Vars vars,
            @JsonProperty("args") Args args,
            @JsonProperty("ignoreRestSiblings") boolean ignoreRestSiblings) {
        Options {
            vars = vars != null ? vars : Vars.ALL;
            args = args != null ? args : Args.AFTER_USED;
        }
    }

    private static final Options DEFAULTS = new Options(Vars.ALL, Args.AFTER_USED, false);

    private final Options options;

    private NoUnusedVars(Options options) {
        super("eslint", NAME);
        this.options = options;
    }

    public static NoUnusedVars fromConfig(Optional<JsonNode> config) {
        if (config.isPresent() && config.get().isTextual()) {
            Vars vars = RuleOptions.bind(config, Vars.class, Vars.ALL);
            return new NoUnusedVars(new Options(vars, Args.AFTER_USED, false));
        }
        return new NoUnusedVars(RuleOptions.bind(config, Options.class, DEFAULTS));
    }

    public Vars getVars() {
        return options.vars();
    }

    public Args getArgs() {
        return options.args();
    }

    public boolean isIgnoreRestSiblings() {
        return options.ignoreRestSiblings();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NoUnusedVars that))
            return false;
        return options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, options);
    }
}
