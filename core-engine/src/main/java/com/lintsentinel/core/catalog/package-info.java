/**
 * The rule catalog seam.
 *
 * <p>
 * Rule implementations plug in by implementing
 * {@link com.lintsentinel.core.catalog.RuleDescriptor} and being listed in a
 * {@link com.lintsentinel.core.catalog.RuleCatalog}.
 * </p>
 *
 * @since 1.0.0
 */
package com.lintsentinel.core.catalog;
