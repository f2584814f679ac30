package com.lintsentinel.rules.jest;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.rules.BaseRule;

import java.util.Optional;

/**
 * Reports skipped tests ({@code xit}, {@code test.skip}, ...). Takes no
 * options.
 */
public final class NoDisabledTests extends BaseRule {

    public static final String NAME = "no-disabled-tests";

    private static final NoDisabledTests INSTANCE = new NoDisabledTests();

    private NoDisabledTests() {
        super("jest", NAME);
    }

    public static NoDisabledTests fromConfig(Optional<JsonNode> config) {
        return INSTANCE;
    }
}
