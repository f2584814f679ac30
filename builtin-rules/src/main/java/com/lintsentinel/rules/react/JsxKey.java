package com.lintsentinel.rules.react;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;
import com.lintsentinel.rules.RuleOptions;

import java.util.Optional;

/**
 * Requires a {@code key} prop on elements created in iterators and array
 * literals.
 */
public final class JsxKey extends BaseRule {

    public static final String NAME = "jsx-key";

    record Options(@JsonProperty("checkFragmentShorthand") boolean checkFragmentShorthand) {
    }

    private static final Options DEFAULTS = new Options(false);

    private final boolean checkFragmentShorthand;

    private JsxKey(Options options) {
        super("react", NAME);
        this.checkFragmentShorthand = options.checkFragmentShorthand();
    }

    public static JsxKey fromConfig(Optional<JsonNode> config) {
        return new JsxKey(RuleOptions.bind(config, Options.class, DEFAULTS));
    }

    /**
     * @return whether {@code <>} fragments in iterators are reported too
     */
    public boolean isCheckFragmentShorthand() {
        return checkFragmentShorthand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JsxKey that))
            return false;
        return checkFragmentShorthand == that.checkFragmentShorthand;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(checkFragmentShorthand);
    }
}
