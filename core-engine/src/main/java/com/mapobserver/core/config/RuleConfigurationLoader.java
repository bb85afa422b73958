package com.mapobserver.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mapobserver.core.model.RuleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads a {@link RuleConfiguration} from JSON or YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>{@link EngineConfig#getRulesConfigPath()} (file system path)</li>
 * <li>Otherwise the empty configuration</li>
 * </ol>
 *
 * <p>
 * Sources ending in {@code .yml} or {@code .yaml} are read with SnakeYAML;
 * everything else is read as JSON. Malformed input fails fast.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleConfigurationLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RuleConfigurationLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the default configuration named by {@code config}.
     *
     * @param config engine configuration; must not be {@code null}
     * @return the parsed configuration, or empty if no path is configured
     * @throws IllegalArgumentException if the configured file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static RuleConfiguration load(EngineConfig config) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        String path = config.getRulesConfigPath();
        if (path == null || path.isBlank()) {
            LOG.info("No rule configuration path set, using empty configuration");
            return RuleConfiguration.empty();
        }
        LOG.info("Loading rule configuration from: {}", path);
        return fromFile(path);
    }

    /**
     * Parse a configuration from a JSON string.
     *
     * @param json the JSON text; must not be {@code null}
     * @return the parsed configuration
     * @throws IllegalStateException if the text is not a JSON object
     */
    public static RuleConfiguration fromJson(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            return toConfiguration(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed rule configuration JSON", e);
        }
    }

    /**
     * Load a configuration from a file system path.
     *
     * @param path path to a JSON or YAML file; must not be {@code null}
     * @return the parsed configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static RuleConfiguration fromFile(String path) {
        Objects.requireNonNull(path, "Rule configuration file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rule configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rule configuration file: " + path, e);
        }
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return the parsed configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static RuleConfiguration fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RuleConfigurationLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RuleConfiguration parse(InputStream is, String source) throws IOException {
        String lower = source.toLowerCase(Locale.ROOT);
        JsonNode tree;
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            LoaderOptions options = new LoaderOptions();
            options.setAllowDuplicateKeys(false);
            Yaml yaml = new Yaml(new SafeConstructor(options));
            try {
                tree = MAPPER.valueToTree(yaml.load(is));
            } catch (YAMLException | IllegalArgumentException e) {
                throw new IllegalStateException("Malformed rule configuration YAML: " + source, e);
            }
        } else {
            try {
                tree = MAPPER.readTree(is);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Malformed rule configuration JSON: " + source, e);
            }
        }

        RuleConfiguration configuration = toConfiguration(tree);
        LOG.info("Loaded {} rule configuration(s) from {}", configuration.size(), source);
        return configuration;
    }

    private static RuleConfiguration toConfiguration(JsonNode tree) {
        try {
            return RuleConfiguration.fromJson(tree);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
