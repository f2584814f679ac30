package com.lintsentinel.rules.eslint;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;

import java.util.Optional;

/**
 * Disallows {@code debugger} statements. Takes no options.
 */
public final class NoDebugger extends BaseRule {

    public static final String NAME = "no-debugger";

    private static final NoDebugger INSTANCE = new NoDebugger();

    private NoDebugger() {
        super("eslint", NAME);
    }

    public static NoDebugger fromConfig(Optional<JsonNode> config) {
        return INSTANCE;
    }
}
