package com.lintsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.lintsentinel.core.config.LintConfigException;

import java.util.Objects;

/**
 * Severity level of a configured rule.
 *
 * <p>
 * Accepted spellings (case-sensitive):
 * </p>
 * <ul>
 * <li>{@link #OFF} - {@code "off"}, {@code "allow"} or {@code 0}</li>
 * <li>{@link #WARN} - {@code "warn"} or {@code 1}</li>
 * <li>{@link #ERROR} - {@code "error"}, {@code "deny"} or {@code 2}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum Severity {

    OFF,
    WARN,
    ERROR;

    /**
     * @return {@code true} for {@link #WARN} and {@link #ERROR}
     */
    public boolean isEnabled() {
        return this != OFF;
    }

    /**
     * Parse a severity token.
     *
     * @param token the token; must not be {@code null}
     * @return the matching severity
     * @throws LintConfigException kind {@code INVALID_SEVERITY} if the token is
     *                             not recognised
     */
    public static Severity fromToken(String token) {
        Objects.requireNonNull(token, "Severity token must not be null");
        return switch (token) {
            case "off", "allow" -> OFF;
            case "warn" -> WARN;
            case "error", "deny" -> ERROR;
            default -> throw LintConfigException.invalidSeverity('"' + token + '"');
        };
    }

    /**
     * Parse a severity from a JSON value.
     *
     * <p>
     * Accepts a string token, an integer level {@code 0} to {@code 2}, or an
     * array whose first element is one of those.
     * </p>
     *
     * @param value the JSON value; must not be {@code null}
     * @return the matching severity
     * @throws LintConfigException kind {@code INVALID_SEVERITY} for any other
     *                             value
     */
    public static Severity parse(JsonNode value) {
        Objects.requireNonNull(value, "Severity value must not be null");

        JsonNode level = value.isArray() && !value.isEmpty() ? value.get(0) : value;
        if (level.isTextual()) {
            return fromToken(level.textValue());
        }
        if (level.isIntegralNumber() && level.canConvertToInt()) {
            // ESLint numeric levels follow declaration order
            int ordinal = level.intValue();
            if (ordinal >= 0 && ordinal < values().length) {
                return values()[ordinal];
            }
        }
        throw LintConfigException.invalidSeverity(value.toString());
    }
}
