package com.lintsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies a lint rule by its plugin category and rule name.
 *
 * <p>
 * Raw keys from the {@code rules} object are normalised through
 * {@link #parse(String)}:
 * </p>
 * <ul>
 * <li>{@code no-console} - category {@value #DEFAULT_CATEGORY}, name
 * {@code no-console}</li>
 * <li>{@code react/jsx-key} - category {@code react}, name
 * {@code jsx-key}</li>
 * <li>{@code @typescript-eslint/no-explicit-any} - category
 * {@code typescript}, name {@code no-explicit-any}</li>
 * </ul>
 *
 * <p>
 * Equality and hashing are defined by the (category, name) pair.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleId implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Category assumed for keys without a {@code /} separator. */
    public static final String DEFAULT_CATEGORY = "eslint";

    private static final String TYPESCRIPT_ESLINT = "typescript-eslint";
    private static final String TYPESCRIPT = "typescript";

    private final String category;
    private final String name;

    private RuleId(String category, String name) {
        this.category = category;
        this.name = name;
    }

    /**
     * Create an identifier from an already normalised category and name.
     *
     * @param category plugin category; must not be {@code null}
     * @param name     rule name; must not be {@code null}
     * @return the identifier
     */
    public static RuleId of(String category, String name) {
        Objects.requireNonNull(category, "Rule category must not be null");
        Objects.requireNonNull(name, "Rule name must not be null");
        return new RuleId(category, name);
    }

    /**
     * Parse a raw rule key as it appears in the {@code rules} object.
     *
     * <p>
     * The key is split on the first {@code /}. Leading {@code @} characters
     * are trimmed from the category and {@code typescript-eslint} is folded
     * into {@code typescript}. The name is kept verbatim, so a key ending in
     * {@code /} yields an empty name.
     * </p>
     *
     * @param raw the raw key; must not be {@code null}
     * @return the parsed identifier, never {@code null}
     */
    public static RuleId parse(String raw) {
        Objects.requireNonNull(raw, "Rule key must not be null");

        int slash = raw.indexOf('/');
        if (slash < 0) {
            return new RuleId(DEFAULT_CATEGORY, raw);
        }

        String category = stripLeadingAt(raw.substring(0, slash));
        if (TYPESCRIPT_ESLINT.equals(category)) {
            category = TYPESCRIPT;
        }
        return new RuleId(category, raw.substring(slash + 1));
    }

    private static String stripLeadingAt(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '@') {
            start++;
        }
        return value.substring(start);
    }

    public String getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleId that))
            return false;
        return category.equals(that.category) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name);
    }

    /**
     * @return {@code category/name}
     */
    @Override
    public String toString() {
        return category + '/' + name;
    }
}
