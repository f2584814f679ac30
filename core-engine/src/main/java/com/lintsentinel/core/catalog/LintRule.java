package com.lintsentinel.core.catalog;

import com.lintsentinel.core.model.RuleId;

/**
 * A fully configured rule instance, ready to be handed to the lint
 * execution engine.
 *
 * <p>
 * Instances are produced by {@link RuleDescriptor#configure(java.util.Optional)}
 * and are expected to be immutable.
 * </p>
 */
public interface LintRule {

    /**
     * Return the plugin category this rule belongs to.
     *
     * @return category, e.g. {@code eslint} or {@code react}
     */
    String getCategory();

    /**
     * Return the rule name within its category.
     *
     * @return rule name
     */
    String getName();

    /**
     * @return the (category, name) identifier of this rule
     */
    default RuleId getId() {
        return RuleId.of(getCategory(), getName());
    }
}
