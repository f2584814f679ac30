package com.lintsentinel.rules;

import com.lintsentinel.core.catalog.LintRule;

import java.util.Objects;

/**
 * Common identity for built-in rules.
 */
public abstract class BaseRule implements LintRule {

    private final String category;
    private final String name;

    protected BaseRule(String category, String name) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public final String getCategory() {
        return category;
    }

    @Override
    public final String getName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + category + '/' + name + '}';
    }
}
