package com.mapobserver.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Default {@link RuleValidator}.
 *
 * <h3>Passes</h3>
 * <ol>
 * <li><strong>Structural</strong>: the configuration must be a non-empty JSON
 * object whose keys match {@code ^[A-Za-z][A-Za-z0-9_]*$}.</li>
 * <li><strong>Schema</strong>: the configuration is checked against the
 * supplied schema by {@link JsonSchemaValidator}.</li>
 * </ol>
 * <p>
 * Both passes always run and their messages are reported together. A
 * failing pass logs a structured warning carrying the messages and the
 * offending configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleConfigValidator implements RuleValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleConfigValidator.class);

    /** Pattern every rule name must match. */
    public static final Pattern RULE_NAME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");

    static final String MISSING_SCHEMA = "Schema must not be null";

    private final JsonSchemaValidator schemaValidator;

    public RuleConfigValidator() {
        this(new JsonSchemaValidator());
    }

    /**
     * @param schemaValidator the schema validator to delegate to; must not be
     *                        {@code null}
     */
    public RuleConfigValidator(JsonSchemaValidator schemaValidator) {
        this.schemaValidator = Objects.requireNonNull(schemaValidator,
                "JsonSchemaValidator must not be null");
    }

    @Override
    public List<String> validate(JsonNode configuration, JsonNode schema) {
        List<String> errors = new ArrayList<>(validateStructure(configuration));

        if (schema == null) {
            errors.add(MISSING_SCHEMA);
            logFailure("JSON schema validation failed", errors, configuration);
        } else if (configuration != null) {
            List<String> schemaErrors = schemaValidator.validate(configuration, schema);
            if (!schemaErrors.isEmpty()) {
                logFailure("JSON schema validation failed", schemaErrors, configuration);
            }
            errors.addAll(schemaErrors);
        }
        return Collections.unmodifiableList(errors);
    }

    @Override
    public List<String> validateStructure(JsonNode configuration) {
        List<String> errors = new ArrayList<>();

        if (configuration == null || configuration.isNull() || configuration.isMissingNode()) {
            errors.add("Configuration cannot be empty");
        } else if (!configuration.isObject()) {
            errors.add("Configuration must be a JSON object");
        } else if (configuration.isEmpty()) {
            errors.add("Configuration cannot be empty");
        } else {
            Iterator<String> names = configuration.fieldNames();
            while (names.hasNext()) {
                String ruleName = names.next();
                if (ruleName.isEmpty()) {
                    errors.add("Rule name must be a non-empty string");
                } else if (!RULE_NAME_PATTERN.matcher(ruleName).matches()) {
                    errors.add("Invalid rule name format: " + ruleName);
                }
            }
        }

        if (!errors.isEmpty()) {
            logFailure("Basic rule configuration validation failed", errors, configuration);
        }
        return Collections.unmodifiableList(errors);
    }

    @Override
    public List<String> validateRule(String ruleName, JsonNode ruleConfiguration, JsonNode ruleSchema) {
        List<String> errors;
        if (ruleSchema == null) {
            errors = List.of(MISSING_SCHEMA);
        } else if (ruleConfiguration == null) {
            errors = List.of("[" + ruleName + "] Rule configuration must not be null");
        } else {
            errors = schemaValidator.validate(ruleConfiguration, ruleSchema, ruleName == null ? "" : ruleName);
        }
        if (!errors.isEmpty()) {
            LOG.atWarn()
                    .addKeyValue("rule", ruleName)
                    .addKeyValue("errors", errors)
                    .addKeyValue("config", String.valueOf(ruleConfiguration))
                    .log("Rule configuration validation failed");
        }
        return Collections.unmodifiableList(errors);
    }

    private static void logFailure(String message, List<String> errors, JsonNode configuration) {
        LOG.atWarn()
                .addKeyValue("errors", errors)
                .addKeyValue("config", String.valueOf(configuration))
                .log(message);
    }
}
