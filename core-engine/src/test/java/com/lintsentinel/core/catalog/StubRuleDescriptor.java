package com.lintsentinel.core.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Synthetic catalog entry for tests. The configured rule keeps whatever
 * config value it was given; a config of {@code "reject"} is refused.
 */
public final class StubRuleDescriptor implements RuleDescriptor {

    private final String category;
    private final String name;

    public StubRuleDescriptor(String category, String name) {
        this.category = category;
        this.name = name;
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
        if (config.isPresent() && "reject".equals(config.get().asText())) {
            throw new IllegalArgumentException("option 'reject' is not supported");
        }
        return new StubRule(category, name, config.orElse(null));
    }

    /**
     * Configured stub; equality covers the config so repeated resolutions
     * can be compared.
     */
    public static final class StubRule implements LintRule {

        private final String category;
        private final String name;
        private final JsonNode config;

        StubRule(String category, String name, JsonNode config) {
            this.category = category;
            this.name = name;
            this.config = config;
        }

        @Override
        public String getCategory() {
            return category;
        }

        @Override
        public String getName() {
            return name;
        }

        public Optional<JsonNode> getConfig() {
            return Optional.ofNullable(config);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof StubRule that))
                return false;
            return category.equals(that.category) && name.equals(that.name)
                    && Objects.equals(config, that.config);
        }

        @Override
        public int hashCode() {
            return Objects.hash(category, name, config);
        }
    }
}
