package com.lintsentinel.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.Optional;

/**
 * Binds a rule's configuration value onto its options type with Jackson.
 *
 * <p>
 * Unknown properties are rejected so that misspelled options surface as
 * configuration errors instead of being silently ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleOptions {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RuleOptions() {
        // not instantiable
    }

    /**
     * Bind {@code config} onto {@code type}.
     *
     * @param config   the configuration value; empty or JSON {@code null}
     *                 yields {@code defaults}
     * @param type     target options type
     * @param defaults value used when no configuration is given
     * @param <T>      options type
     * @return the bound options
     * @throws IllegalArgumentException if the value does not fit {@code type}
     */
    public static <T> T bind(Optional<JsonNode> config, Class<T> type, T defaults) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(type, "type must not be null");

        if (config.isEmpty() || config.get().isNull()) {
            return defaults;
        }
        try {
            T options = MAPPER.treeToValue(config.get(), type);
            return options != null ? options : defaults;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Expected " + type.getSimpleName() + " but got " + config.get() + ": "
                            + e.getOriginalMessage(), e);
        }
    }
}
