/**
 * Built-in lint rules and their catalog.
 *
 * <p>
 * Each rule lives in a sub-package named after its plugin category and
 * exposes a static {@code fromConfig} factory that binds the optional
 * configuration value. {@link com.lintsentinel.rules.BuiltinRules} lists
 * them in a {@link com.lintsentinel.core.catalog.RuleCatalog}.
 * </p>
 *
 * @since 1.0.0
 */
package com.lintsentinel.rules;
