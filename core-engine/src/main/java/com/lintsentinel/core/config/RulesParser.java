package com.lintsentinel.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.core.model.RuleId;
import com.lintsentinel.core.model.RuleOverride;
import com.lintsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the {@code rules} object into explicit per-rule overrides.
 *
 * <p>
 * Two value shapes are accepted for every entry:
 * </p>
 *
 * <pre>
 * "no-console": "off"
 * "no-console": ["warn", { "allow": ["error"] }]
 * </pre>
 *
 * <p>
 * A missing or non-object {@code rules} property yields no overrides. The
 * first malformed entry aborts the parse.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesParser {

    private static final Logger LOG = LoggerFactory.getLogger(RulesParser.class);

    static final String PROPERTY = "rules";

    private RulesParser() {
        // not instantiable
    }

    /**
     * Parse the {@code rules} object of a configuration document.
     *
     * @param document the configuration document; must not be {@code null}
     * @return unmodifiable map of overrides in document order
     * @throws LintConfigException kind {@code INVALID_RULE_VALUE} or
     *                             {@code INVALID_SEVERITY} for the first
     *                             malformed entry
     */
    public static Map<RuleId, RuleOverride> parse(JsonNode document) {
        Objects.requireNonNull(document, "Config document must not be null");
        if (!document.isObject()) {
            return Collections.emptyMap();
        }
        JsonNode rules = document.get(PROPERTY);
        if (rules == null || !rules.isObject()) {
            return Collections.emptyMap();
        }

        Map<RuleId, RuleOverride> overrides = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            RuleId id = RuleId.parse(entry.getKey());
            if (id.getName().isEmpty()) {
                LOG.warn("Rule key '{}' has an empty rule name and will not match any rule",
                        entry.getKey());
            }
            overrides.put(id, parseValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(overrides);
    }

    /**
     * Parse a single {@code rules} entry value.
     *
     * @param value the entry value; must not be {@code null}
     * @return the severity and optional rule configuration
     * @throws LintConfigException kind {@code INVALID_RULE_VALUE} if the value
     *                             is neither a string nor a non-empty array,
     *                             {@code INVALID_SEVERITY} if the severity
     *                             token is not recognised
     */
    public static RuleOverride parseValue(JsonNode value) {
        Objects.requireNonNull(value, "Rule value must not be null");

        if (value.isTextual()) {
            return RuleOverride.of(Severity.parse(value));
        }
        if (value.isArray() && !value.isEmpty()) {
            JsonNode level = value.get(0);
            if (level.isArray()) {
                throw LintConfigException.invalidSeverity(level.toString());
            }
            return RuleOverride.of(Severity.parse(level), value.get(1));
        }
        throw LintConfigException.invalidRuleValue(value.toString());
    }
}
