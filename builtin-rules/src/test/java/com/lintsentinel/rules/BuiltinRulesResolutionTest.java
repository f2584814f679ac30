package com.lintsentinel.rules;

import com.lintsentinel.core.config.LintConfigException;
import com.lintsentinel.core.config.LintConfigLoader;
import com.lintsentinel.core.model.RuleId;
import com.lintsentinel.core.model.Severity;
import com.lintsentinel.core.resolution.LintConfig;
import com.lintsentinel.core.resolution.ResolvedRule;
import com.lintsentinel.rules.eslint.Eqeqeq;
import com.lintsentinel.rules.eslint.NoConsole;
import com.lintsentinel.rules.eslint.NoUnusedVars;
import com.lintsentinel.rules.react.JsxKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Resolves configuration files against the built-in catalog.
 */
class BuiltinRulesResolutionTest {

    @Test
    @DisplayName("Recommended preset with overrides keeps preset rules and honours explicit entries")
    void shouldResolveRecommendedConfig() {
        LintConfig config = LintConfigLoader.fromClasspath("configs/recommended.json", BuiltinRules.catalog());

        assertThat(config.getRuleNames())
                .containsExactly("eqeqeq", "no-console", "no-debugger", "no-unused-vars");
        assertThat(config.getRule(RuleId.of("eslint", "no-console")))
                .hasValueSatisfying(r -> assertThat(r.getSeverity()).isEqualTo(Severity.ERROR));
        assertThat(config.isActive(RuleId.of("react", "jsx-key"))).isFalse();
    }

    @Test
    @DisplayName("Should pass rule options through to configured rules")
    void shouldResolveFullConfig() {
        LintConfig config = LintConfigLoader.fromClasspath("configs/full.json", BuiltinRules.catalog());

        assertThat(config.getRuleNames()).containsExactly(
                "eqeqeq", "jsx-key", "no-console", "no-disabled-tests", "no-null", "no-unused-vars");

        NoConsole noConsole = (NoConsole) rule(config, "eslint", "no-console").getRule();
        assertThat(noConsole.getAllow()).containsExactly("warn", "error");
        assertThat(noConsole.isAllowed("log")).isFalse();

        NoUnusedVars unused = (NoUnusedVars) rule(config, "eslint", "no-unused-vars").getRule();
        assertThat(unused.getVars()).isEqualTo(NoUnusedVars.Vars.LOCAL);
        assertThat(unused.getArgs()).isEqualTo(NoUnusedVars.Args.NONE);
        assertThat(unused.isIgnoreRestSiblings()).isTrue();

        assertThat(((Eqeqeq) rule(config, "eslint", "eqeqeq").getRule()).getMode())
                .isEqualTo(Eqeqeq.Mode.SMART);
        assertThat(((JsxKey) rule(config, "react", "jsx-key").getRule()).isCheckFragmentShorthand())
                .isTrue();

        ResolvedRule disabledTests = rule(config, "jest", "no-disabled-tests");
        assertThat(disabledTests.isExplicit()).isFalse();
        assertThat(disabledTests.getSeverity()).isEqualTo(Severity.WARN);

        assertThat(rule(config, "unicorn", "no-null").getSeverity()).isEqualTo(Severity.ERROR);
    }

    @Test
    @DisplayName("Rejected rule options fail the whole resolution")
    void shouldFailOnRejectedOptions() {
        assertThatThrownBy(() -> LintConfigLoader.fromClasspath("configs/bad-option.json", BuiltinRules.catalog()))
                .isInstanceOf(LintConfigException.class)
                .hasMessageContaining("react/jsx-key")
                .satisfies(e -> assertThat(((LintConfigException) e).getKind())
                        .isEqualTo(LintConfigException.Kind.INVALID_RULE_CONFIG));
    }

    @Test
    @DisplayName("Resolving the same file twice yields identical rule sets")
    void shouldBeIdempotent() {
        LintConfig first = LintConfigLoader.fromClasspath("configs/full.json", BuiltinRules.catalog());
        LintConfig second = LintConfigLoader.fromClasspath("configs/full.json", BuiltinRules.catalog());

        assertThat(second).isEqualTo(first);
    }

    private static ResolvedRule rule(LintConfig config, String category, String name) {
        return config.getRule(RuleId.of(category, name)).orElseThrow();
    }
}
