/**
 * Value types shared by the configuration parser and the resolver.
 *
 * <ul>
 * <li>{@link com.lintsentinel.core.model.RuleId} - (category, name) rule
 * identifier and rule key normalisation</li>
 * <li>{@link com.lintsentinel.core.model.Severity} - off / warn / error</li>
 * <li>{@link com.lintsentinel.core.model.RuleOverride} - explicit entry from
 * the {@code rules} object</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.lintsentinel.core.model;
