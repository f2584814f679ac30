package com.lintsentinel.core.config;

import com.lintsentinel.core.model.RuleId;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised when a lint configuration cannot be loaded or resolved.
 *
 * <p>
 * Every failure aborts resolution; callers never receive a partially
 * resolved rule set. The {@link Kind} tells which stage rejected the input,
 * and the optional path, raw value and rule id carry the context needed for
 * a user-facing diagnostic.
 * </p>
 *
 * @since 1.0.0
 */
public class LintConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Failure categories.
     */
    public enum Kind {
        /** The configuration file could not be read. */
        FILE_OPEN,
        /** The file content is not valid JSON (or YAML). */
        INVALID_JSON,
        /** A top-level property has the wrong shape. */
        INVALID_PROPERTY,
        /** A {@code rules} entry is neither a string nor a non-empty array. */
        INVALID_RULE_VALUE,
        /** A severity token is outside the accepted vocabulary. */
        INVALID_SEVERITY,
        /** A rule rejected its own configuration value. */
        INVALID_RULE_CONFIG
    }

    private final Kind kind;
    private final transient Path path;
    private final String rawValue;
    private final RuleId ruleId;

    private LintConfigException(Kind kind, String message, Path path, String rawValue,
            RuleId ruleId, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.path = path;
        this.rawValue = rawValue;
        this.ruleId = ruleId;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static LintConfigException fileOpen(Path path, Throwable cause) {
        return new LintConfigException(Kind.FILE_OPEN,
                "Failed to open config file " + path + ": " + cause.getMessage(),
                path, null, null, cause);
    }

    public static LintConfigException invalidJson(Path path, String parserMessage, Throwable cause) {
        String location = path != null ? " " + path : "";
        return new LintConfigException(Kind.INVALID_JSON,
                "Failed to parse config" + location + " as JSON: " + parserMessage,
                path, null, null, cause);
    }

    public static LintConfigException invalidProperty(String property, String reason) {
        return new LintConfigException(Kind.INVALID_PROPERTY,
                "Failed to parse config property '" + property + "': " + reason,
                null, null, null, null);
    }

    public static LintConfigException invalidRuleValue(String rawValue) {
        return new LintConfigException(Kind.INVALID_RULE_VALUE,
                "Failed to parse rule value " + rawValue + ": Invalid rule value",
                null, rawValue, null, null);
    }

    public static LintConfigException invalidSeverity(String rawValue) {
        return new LintConfigException(Kind.INVALID_SEVERITY,
                "Failed to parse rule severity " + rawValue
                        + ": expected one of \"off\", \"warn\", \"error\", \"allow\", \"deny\", 0, 1, 2",
                null, rawValue, null, null);
    }

    public static LintConfigException invalidRuleConfig(RuleId ruleId, Throwable cause) {
        return new LintConfigException(Kind.INVALID_RULE_CONFIG,
                "Invalid configuration for rule '" + ruleId + "': " + cause.getMessage(),
                null, null, ruleId, cause);
    }

    /**
     * Copy this failure with the configuration file it came from attached.
     *
     * @param source the configuration file; must not be {@code null}
     * @return a new exception of the same kind, or this one if it already
     *         names a path
     */
    public LintConfigException withPath(Path source) {
        Objects.requireNonNull(source, "Config file path must not be null");
        if (path != null) {
            return this;
        }
        LintConfigException copy = new LintConfigException(kind,
                "In config " + source + ": " + getMessage(),
                source, rawValue, ruleId, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the configuration file involved, if the failure is tied to one
     */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    /**
     * @return the offending JSON value in serialized form, if any
     */
    public Optional<String> getRawValue() {
        return Optional.ofNullable(rawValue);
    }

    /**
     * @return the rule whose configuration was rejected, if any
     */
    public Optional<RuleId> getRuleId() {
        return Optional.ofNullable(ruleId);
    }
}
