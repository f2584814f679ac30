package com.lintsentinel.core.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.lintsentinel.core.catalog.RuleCatalog;
import com.lintsentinel.core.resolution.LintConfig;
import com.lintsentinel.core.resolution.RuleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Loads a lint configuration file and resolves it against a
 * {@link RuleCatalog}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(Path, RuleCatalog)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String, RuleCatalog)}</li>
 * </ol>
 *
 * <h3>Formats</h3>
 * <p>
 * Files are parsed as JSON, except {@code .yml} / {@code .yaml} files which
 * are read with SnakeYAML and converted into the same JSON tree. Duplicate
 * object keys are rejected in both formats. In YAML only {@code true} and
 * {@code false} are booleans, so unquoted severities such as {@code off}
 * stay strings.
 * </p>
 *
 * <p>
 * Failures raised while resolving a file carry that file's path.
 * </p>
 *
 * @since 1.0.0
 */
public final class LintConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LintConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "LINT_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = ".eslintrc.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private LintConfigLoader() {
        // not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code LINT_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the
     * classpath.</li>
     * </ol>
     *
     * @param catalog the rule catalog; must not be {@code null}
     * @return the resolved rule set
     * @throws LintConfigException      if loading or resolution fails
     * @throws IllegalArgumentException if neither source exists
     */
    public static LintConfig load(RuleCatalog catalog) {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading lint config from environment path: {}", envPath);
            return fromFile(Path.of(envPath), catalog);
        }
        LOG.info("Loading lint config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE, catalog);
    }

    /**
     * Load and resolve a configuration file.
     *
     * @param path    the configuration file; must not be {@code null}
     * @param catalog the rule catalog; must not be {@code null}
     * @return the resolved rule set
     * @throws LintConfigException kind {@code FILE_OPEN} if the file cannot be
     *                             read, {@code INVALID_JSON} if it does not
     *                             parse, or any resolution failure
     */
    public static LintConfig fromFile(Path path, RuleCatalog catalog) {
        Objects.requireNonNull(path, "Config file path must not be null");
        Objects.requireNonNull(catalog, "Rule catalog must not be null");

        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw LintConfigException.fileOpen(path, e);
        }
        return resolve(parse(content, path), catalog, path);
    }

    /**
     * Load and resolve a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @param catalog  the rule catalog; must not be {@code null}
     * @return the resolved rule set
     * @throws IllegalArgumentException if the resource does not exist
     * @throws LintConfigException      if reading, parsing or resolution fails
     */
    public static LintConfig fromClasspath(String resource, RuleCatalog catalog) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        Objects.requireNonNull(catalog, "Rule catalog must not be null");

        InputStream is = LintConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        String content;
        try (is) {
            content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw LintConfigException.fileOpen(Path.of(resource), e);
        }
        Path source = Path.of(resource);
        return resolve(parse(content, source), catalog, source);
    }

    /**
     * Resolve a configuration held in memory as JSON text.
     *
     * @param json    JSON document; must not be {@code null}
     * @param catalog the rule catalog; must not be {@code null}
     * @return the resolved rule set
     * @throws LintConfigException if parsing or resolution fails
     */
    public static LintConfig fromString(String json, RuleCatalog catalog) {
        Objects.requireNonNull(json, "Config content must not be null");
        Objects.requireNonNull(catalog, "Rule catalog must not be null");
        return resolve(parseJson(json, null), catalog, null);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static JsonNode parse(String content, Path path) {
        String fileName = path.getFileName() != null
                ? path.getFileName().toString().toLowerCase(Locale.ROOT)
                : "";
        if (fileName.endsWith(".yml") || fileName.endsWith(".yaml")) {
            return parseYaml(content, path);
        }
        return parseJson(content, path);
    }

    private static JsonNode parseJson(String content, Path path) {
        JsonNode document;
        try {
            document = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw LintConfigException.invalidJson(path, e.getOriginalMessage(), e);
        }
        if (document == null || document instanceof MissingNode) {
            throw LintConfigException.invalidJson(path, "No content to parse", null);
        }
        return document;
    }

    private static JsonNode parseYaml(String content, Path path) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        DumperOptions dumperOptions = new DumperOptions();
        Yaml yaml = new Yaml(new SafeConstructor(options), new Representer(dumperOptions),
                dumperOptions, options, new StrictBooleanResolver());

        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw LintConfigException.invalidJson(path, e.getMessage(), e);
        }
        if (loaded == null) {
            throw LintConfigException.invalidJson(path, "No content to parse", null);
        }
        try {
            return MAPPER.valueToTree(loaded);
        } catch (IllegalArgumentException e) {
            throw LintConfigException.invalidJson(path, e.getMessage(), e);
        }
    }

    private static LintConfig resolve(JsonNode document, RuleCatalog catalog, Path path) {
        LintConfig config;
        try {
            config = RuleResolver.resolve(catalog, document);
        } catch (LintConfigException e) {
            throw path != null ? e.withPath(path) : e;
        }
        LOG.info("Resolved {} active lint rule(s)", config.size());
        return config;
    }

    /**
     * YAML 1.1 resolver without the {@code yes/no/on/off} booleans.
     */
    private static final class StrictBooleanResolver extends Resolver {

        private static final Pattern STRICT_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.BOOL, STRICT_BOOL, "tTfF");
            // INT must precede FLOAT
            addImplicitResolver(Tag.INT, INT, "-+0123456789");
            addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
            addImplicitResolver(Tag.MERGE, MERGE, "<");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
            addImplicitResolver(Tag.TIMESTAMP, TIMESTAMP, "0123456789");
        }
    }
}
