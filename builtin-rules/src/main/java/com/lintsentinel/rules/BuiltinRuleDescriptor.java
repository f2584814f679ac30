package com.lintsentinel.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.core.catalog.LintRule;
import com.lintsentinel.core.catalog.RuleDescriptor;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Catalog entry for a built-in rule, backed by the rule's own config factory.
 */
final class BuiltinRuleDescriptor implements RuleDescriptor {

    private final String category;
    private final String name;
    private final Function<Optional<JsonNode>, ? extends LintRule> factory;

    BuiltinRuleDescriptor(String category, String name,
            Function<Optional<JsonNode>, ? extends LintRule> factory) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override
    public String getCategory() {
        return category;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public LintRule configure(Optional<JsonNode> config) {
        return factory.apply(Objects.requireNonNull(config, "config must not be null"));
    }

    @Override
    public String toString() {
        return "BuiltinRuleDescriptor{" + category + '/' + name + '}';
    }
}
