package com.lintsentinel.core.resolution;

import com.lintsentinel.core.model.RuleId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The resolved rule set for a single lint run.
 *
 * <p>
 * Rules are ordered by rule name so that diagnostics order does not depend on
 * catalog order or on key order in the configuration document. Rules with
 * the same name in different categories keep their catalog order.
 * </p>
 *
 * @since 1.0.0
 */
public final class LintConfig {

    private static final Comparator<ResolvedRule> BY_NAME = Comparator.comparing(ResolvedRule::getName);

    private final List<ResolvedRule> rules;

    LintConfig(List<ResolvedRule> rules) {
        Objects.requireNonNull(rules, "Resolved rule list must not be null");
        List<ResolvedRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_NAME);
        this.rules = Collections.unmodifiableList(sorted);
    }

    /**
     * @return unmodifiable list of active rules, sorted by name
     */
    public List<ResolvedRule> getRules() {
        return rules;
    }

    /**
     * @return rule names in resolution order
     */
    public List<String> getRuleNames() {
        return rules.stream().map(ResolvedRule::getName).toList();
    }

    public Optional<ResolvedRule> getRule(RuleId id) {
        Objects.requireNonNull(id, "Rule id must not be null");
        return rules.stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    public boolean isActive(RuleId id) {
        return getRule(id).isPresent();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LintConfig that))
            return false;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "LintConfig{rules=" + getRuleNames() + '}';
    }
}
