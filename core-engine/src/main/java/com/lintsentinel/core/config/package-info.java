/**
 * Loading and parsing of lint configuration documents.
 *
 * <p>
 * {@link com.lintsentinel.core.config.LintConfigLoader} reads the file,
 * {@link com.lintsentinel.core.config.ExtendsResolver} and
 * {@link com.lintsentinel.core.config.RulesParser} interpret the
 * {@code extends} and {@code rules} properties. All failures surface as
 * {@link com.lintsentinel.core.config.LintConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.lintsentinel.core.config;
