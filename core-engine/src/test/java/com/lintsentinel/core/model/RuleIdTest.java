package com.lintsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RuleId}.
 */
class RuleIdTest {

    @ParameterizedTest
    @ValueSource(strings = {"no-console", "eqeqeq", "", "@scope"})
    @DisplayName("Keys without a slash fall into the eslint category unchanged")
    void shouldDefaultToEslintCategory(String key) {
        RuleId id = RuleId.parse(key);

        assertThat(id.getCategory()).isEqualTo("eslint");
        assertThat(id.getName()).isEqualTo(key);
    }

    @Test
    @DisplayName("Should split plugin keys on the first slash")
    void shouldSplitOnFirstSlash() {
        RuleId id = RuleId.parse("react/jsx-key");

        assertThat(id).isEqualTo(RuleId.of("react", "jsx-key"));
    }

    @Test
    @DisplayName("Should keep everything after the first slash as the name")
    void shouldKeepRemainingSlashesInName() {
        RuleId id = RuleId.parse("import/no-unresolved/extra");

        assertThat(id.getCategory()).isEqualTo("import");
        assertThat(id.getName()).isEqualTo("no-unresolved/extra");
    }

    @Test
    @DisplayName("Should strip leading @ from scoped categories")
    void shouldStripLeadingAt() {
        assertThat(RuleId.parse("@scope/some-rule")).isEqualTo(RuleId.of("scope", "some-rule"));
        assertThat(RuleId.parse("@@scope/some-rule").getCategory()).isEqualTo("scope");
    }

    @ParameterizedTest
    @ValueSource(strings = {"no-explicit-any", "ban-types", "x"})
    @DisplayName("Should fold typescript-eslint into typescript for any rule name")
    void shouldFoldTypescriptAlias(String name) {
        assertThat(RuleId.parse("@typescript-eslint/" + name))
                .isEqualTo(RuleId.of("typescript", name));
        assertThat(RuleId.parse("typescript-eslint/" + name))
                .isEqualTo(RuleId.of("typescript", name));
    }

    @Test
    @DisplayName("Should yield an empty name for a trailing slash")
    void shouldAllowEmptyName() {
        RuleId id = RuleId.parse("react/");

        assertThat(id.getCategory()).isEqualTo("react");
        assertThat(id.getName()).isEmpty();
    }

    @Test
    @DisplayName("Should compare by category and name")
    void shouldCompareByPair() {
        assertThat(RuleId.of("eslint", "no-console"))
                .isEqualTo(RuleId.parse("no-console"))
                .hasSameHashCodeAs(RuleId.parse("no-console"))
                .isNotEqualTo(RuleId.of("react", "no-console"));
        assertThat(RuleId.parse("react/jsx-key")).hasToString("react/jsx-key");
    }
}
