package com.lintsentinel.core.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.core.model.RuleId;

import java.util.Optional;

/**
 * Catalog entry describing a rule the linter supports.
 *
 * <p>
 * A descriptor knows its identity and how to turn an optional configuration
 * value into a configured {@link LintRule}. It carries no per-run state.
 * </p>
 */
public interface RuleDescriptor {

    String getCategory();

    String getName();

    /**
     * Build a configured rule instance.
     *
     * @param config the rule-specific configuration value, empty when the
     *               configuration supplies none
     * @return the configured rule
     * @throws IllegalArgumentException if the rule rejects {@code config}
     */
    LintRule configure(Optional<JsonNode> config);

    default RuleId getId() {
        return RuleId.of(getCategory(), getName());
    }
}
