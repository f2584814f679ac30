package com.lintsentinel.core.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static table mapping {@code extends} preset names to the plugin category
 * they enable.
 *
 * <p>
 * Presets that are not listed here are ignored by {@link ExtendsResolver};
 * configurations may reference presets this linter does not model yet.
 * </p>
 *
 * @since 1.0.0
 */
public final class Presets {

    private static final Map<String, String> CATEGORIES = Map.of(
            "eslint:recommended", "eslint",
            "plugin:react/recommended", "react",
            "plugin:@typescript-eslint/recommended", "typescript",
            "plugin:react-hooks/recommended", "react",
            "plugin:unicorn/recommended", "unicorn",
            "plugin:jest/recommended", "jest");

    private Presets() {
        // not instantiable
    }

    /**
     * Look up the category a preset enables.
     *
     * @param preset preset name; must not be {@code null}
     * @return the category, or empty if the preset is unknown
     */
    public static Optional<String> categoryOf(String preset) {
        Objects.requireNonNull(preset, "Preset name must not be null");
        return Optional.ofNullable(CATEGORIES.get(preset));
    }

    /**
     * @return every known preset name
     */
    public static Set<String> names() {
        return CATEGORIES.keySet();
    }
}
