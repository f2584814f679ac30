package com.lintsentinel.core.resolution;

import com.lintsentinel.core.catalog.LintRule;
import com.lintsentinel.core.model.RuleId;
import com.lintsentinel.core.model.Severity;

import java.util.Objects;

/**
 * An active rule together with the severity it runs at.
 *
 * <p>
 * {@code explicit} is {@code true} when the rule was enabled by an entry in
 * {@code rules}, and {@code false} when it was enabled only through a preset
 * in {@code extends}. Preset-only rules run at {@link Severity#WARN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedRule {

    private final LintRule rule;
    private final Severity severity;
    private final boolean explicit;

    ResolvedRule(LintRule rule, Severity severity, boolean explicit) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.explicit = explicit;
    }

    public LintRule getRule() {
        return rule;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isExplicit() {
        return explicit;
    }

    public RuleId getId() {
        return rule.getId();
    }

    public String getName() {
        return rule.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResolvedRule that))
            return false;
        return explicit == that.explicit
                && severity == that.severity
                && Objects.equals(rule, that.rule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, severity, explicit);
    }

    @Override
    public String toString() {
        return "ResolvedRule{" + rule.getId() + ", severity=" + severity
                + ", explicit=" + explicit + '}';
    }
}
