package com.lintsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintsentinel.core.config.LintConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest
    @CsvSource({"off,OFF", "allow,OFF", "warn,WARN", "error,ERROR", "deny,ERROR"})
    @DisplayName("Should parse every accepted token")
    void shouldParseTokens(String token, Severity expected) {
        assertThat(Severity.fromToken(token)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Off", "ERROR", "warning", "", "on"})
    @DisplayName("Should reject unknown or differently cased tokens")
    void shouldRejectUnknownTokens(String token) {
        assertThatThrownBy(() -> Severity.fromToken(token))
                .isInstanceOf(LintConfigException.class)
                .satisfies(e -> assertThat(((LintConfigException) e).getKind())
                        .isEqualTo(LintConfigException.Kind.INVALID_SEVERITY));
    }

    @Test
    @DisplayName("Only warn and error are enabled")
    void shouldReportEnabled() {
        assertThat(Severity.OFF.isEnabled()).isFalse();
        assertThat(Severity.WARN.isEnabled()).isTrue();
        assertThat(Severity.ERROR.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should parse severity from JSON strings, numbers and arrays")
    void shouldParseJsonValues() throws Exception {
        assertThat(Severity.parse(json("\"warn\""))).isEqualTo(Severity.WARN);
        assertThat(Severity.parse(json("0"))).isEqualTo(Severity.OFF);
        assertThat(Severity.parse(json("2"))).isEqualTo(Severity.ERROR);
        assertThat(Severity.parse(json("[\"error\", {\"a\": 1}]"))).isEqualTo(Severity.ERROR);
    }

    @ParameterizedTest
    @ValueSource(strings = {"3", "-1", "1.5", "true", "null", "{}", "[]", "[true]"})
    @DisplayName("Should reject JSON values outside the vocabulary with the raw value")
    void shouldRejectInvalidJsonValues(String raw) throws Exception {
        JsonNode value = json(raw);

        assertThatThrownBy(() -> Severity.parse(value))
                .isInstanceOf(LintConfigException.class)
                .satisfies(e -> {
                    LintConfigException ex = (LintConfigException) e;
                    assertThat(ex.getKind()).isEqualTo(LintConfigException.Kind.INVALID_SEVERITY);
                    assertThat(ex.getRawValue()).isPresent();
                });
    }

    private static JsonNode json(String raw) throws Exception {
        return MAPPER.readTree(raw);
    }
}
