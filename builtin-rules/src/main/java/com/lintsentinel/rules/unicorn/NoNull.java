package com.lintsentinel.rules.unicorn;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;
import com.lintsentinel.rules.RuleOptions;

import java.util.Optional;

/**
 * Disallows the {@code null} literal.
 */
public final class NoNull extends BaseRule {

    public static final String NAME = "no-null";

    record Options(@JsonProperty("checkStrictEquality") boolean checkStrictEquality) {
    }

    private static final Options DEFAULTS = new Options(false);

    private final boolean checkStrictEquality;

    private NoNull(Options options) {
        super("unicorn", NAME);
        this.checkStrictEquality = options.checkStrictEquality();
    }

    public static NoNull fromConfig(Optional<JsonNode> config) {
        return new NoNull(RuleOptions.bind(config, Options.class, DEFAULTS));
    }

    /**
     * @return whether {@code === null} comparisons are reported
     */
    public boolean isCheckStrictEquality() {
        return checkStrictEquality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NoNull that))
            return false;
        return checkStrictEquality == that.checkStrictEquality;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(checkStrictEquality);
    }
}
