package com.lintsentinel.core.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.core.catalog.LintRule;
import com.lintsentinel.core.catalog.RuleCatalog;
import com.lintsentinel.core.catalog.RuleDescriptor;
import com.lintsentinel.core.config.ExtendsResolver;
import com.lintsentinel.core.config.LintConfigException;
import com.lintsentinel.core.config.RulesParser;
import com.lintsentinel.core.model.RuleId;
import com.lintsentinel.core.model.RuleOverride;
import com.lintsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the active rule set from a {@link RuleCatalog}, the categories
 * enabled through {@code extends} and the explicit {@code rules} overrides.
 *
 * <h3>Merge semantics</h3>
 * <p>
 * A catalog rule is active when
 * </p>
 *
 * <pre>
 * (its category is extended AND it has no explicit entry) OR its explicit severity is enabled
 * </pre>
 *
 * <p>
 * An explicit entry is authoritative whenever present: it can switch off a
 * rule enabled by a preset and switch on a rule no preset enables. Rules
 * mentioned by neither are inactive.
 * </p>
 *
 * <p>
 * The resolver holds no state and never mutates its inputs, so it can be
 * called concurrently for different configurations.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RuleResolver.class);

    /** Severity assigned to rules enabled only through a preset. */
    static final Severity PRESET_SEVERITY = Severity.WARN;

    private RuleResolver() {
        // not instantiable
    }

    /**
     * Resolve a parsed configuration document against a catalog.
     *
     * @param catalog  the rule catalog; must not be {@code null}
     * @param document the configuration document; must not be {@code null}
     * @return the resolved rule set
     * @throws LintConfigException if the document is malformed or a rule
     *                             rejects its configuration
     */
    public static LintConfig resolve(RuleCatalog catalog, JsonNode document) {
        Objects.requireNonNull(catalog, "Rule catalog must not be null");
        Objects.requireNonNull(document, "Config document must not be null");

        Set<String> extendsSet = ExtendsResolver.resolve(document).orElse(Collections.emptySet());
        Map<RuleId, RuleOverride> overrides = RulesParser.parse(document);
        return resolve(catalog, extendsSet, overrides);
    }

    /**
     * Combine presets and overrides against the catalog.
     *
     * @param catalog    the rule catalog; must not be {@code null}
     * @param extendsSet categories enabled by default; must not be
     *                   {@code null}
     * @param overrides  explicit rule entries; must not be {@code null}
     * @return the resolved rule set, sorted by rule name
     * @throws LintConfigException kind {@code INVALID_RULE_CONFIG} if a rule
     *                             rejects its configuration
     */
    public static LintConfig resolve(RuleCatalog catalog,
            Set<String> extendsSet,
            Map<RuleId, RuleOverride> overrides) {
        Objects.requireNonNull(catalog, "Rule catalog must not be null");
        Objects.requireNonNull(extendsSet, "Extends set must not be null");
        Objects.requireNonNull(overrides, "Override map must not be null");

        if (LOG.isDebugEnabled()) {
            overrides.keySet().stream()
                    .filter(id -> !catalog.contains(id))
                    .forEach(id -> LOG.debug("Ignoring override for unknown rule '{}'", id));
        }

        List<ResolvedRule> active = new ArrayList<>();
        for (RuleDescriptor descriptor : catalog.getDescriptors()) {
            RuleId id = descriptor.getId();
            boolean inExtends = extendsSet.contains(descriptor.getCategory());
            RuleOverride override = overrides.get(id);
            boolean explicit = override != null;
            Severity severity = explicit ? override.getSeverity() : Severity.OFF;

            if (!((inExtends && !explicit) || severity.isEnabled())) {
                LOG.debug("Rule [{}] inactive (extended={}, explicit={})", id, inExtends, explicit);
                continue;
            }

            Optional<JsonNode> config = explicit ? override.getConfig() : Optional.empty();
            LintRule rule = configure(descriptor, id, config);
            active.add(new ResolvedRule(rule, explicit ? severity : PRESET_SEVERITY, explicit));
            LOG.debug("Rule [{}] active (extended={}, explicit={})", id, inExtends, explicit);
        }

        LintConfig result = new LintConfig(active);
        LOG.debug("Resolved {} of {} catalog rule(s)", result.size(), catalog.size());
        return result;
    }

    private static LintRule configure(RuleDescriptor descriptor, RuleId id, Optional<JsonNode> config) {
        LintRule rule;
        try {
            rule = descriptor.configure(config);
        } catch (IllegalArgumentException e) {
            throw LintConfigException.invalidRuleConfig(id, e);
        }
        return Objects.requireNonNull(rule, "Rule descriptor '" + id + "' returned null");
    }
}
