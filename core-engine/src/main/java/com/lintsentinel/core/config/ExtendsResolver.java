package com.lintsentinel.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the {@code extends} property into the set of plugin categories
 * enabled by default.
 *
 * <p>
 * Only a structural violation is fatal: {@code extends} must be an array.
 * Non-string elements and presets missing from {@link Presets} are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExtendsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ExtendsResolver.class);

    static final String PROPERTY = "extends";

    private ExtendsResolver() {
        // not instantiable
    }

    /**
     * Resolve the categories named by {@code extends}.
     *
     * @param document the configuration document; must not be {@code null}
     * @return unmodifiable set of categories in first-seen order, or empty if
     *         the document has no {@code extends} key
     * @throws LintConfigException kind {@code INVALID_PROPERTY} if
     *                             {@code extends} is not an array
     */
    public static Optional<Set<String>> resolve(JsonNode document) {
        Objects.requireNonNull(document, "Config document must not be null");

        JsonNode extendsNode = document.get(PROPERTY);
        if (extendsNode == null) {
            return Optional.empty();
        }
        if (!extendsNode.isArray()) {
            throw LintConfigException.invalidProperty(PROPERTY, "Expected an array.");
        }

        Set<String> categories = new LinkedHashSet<>();
        for (JsonNode element : extendsNode) {
            if (!element.isTextual()) {
                continue;
            }
            String preset = element.textValue();
            Optional<String> category = Presets.categoryOf(preset);
            if (category.isPresent()) {
                categories.add(category.get());
            } else {
                LOG.debug("Ignoring unknown preset '{}'", preset);
            }
        }
        return Optional.of(Collections.unmodifiableSet(categories));
    }
}
