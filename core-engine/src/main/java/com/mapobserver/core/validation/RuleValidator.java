package com.mapobserver.core.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Contract for rule configuration validators.
 *
 * <p>
 * Implementations never throw for invalid input: every method returns the
 * list of violations found, empty when the input is valid. A missing schema
 * is reported as a violation as well. Callers decide how to react.
 * </p>
 *
 * @since 1.0.0
 */
public interface RuleValidator {

    /**
     * Run the structural and the schema pass over a whole configuration.
     *
     * @param configuration the raw configuration
     * @param schema        the aggregate schema of all known rules
     * @return every violation of both passes, structural ones first
     */
    List<String> validate(JsonNode configuration, JsonNode schema);

    /**
     * Run only the structural pass: non-empty object with well-formed rule
     * names.
     *
     * @param configuration the raw configuration
     * @return structural violations
     */
    List<String> validateStructure(JsonNode configuration);

    /**
     * Validate one rule's configuration slice against that rule's schema.
     *
     * @param ruleName          rule name, used as the path prefix of messages
     * @param ruleConfiguration the slice, including its {@code _state}
     * @param ruleSchema        the rule's own schema
     * @return schema violations
     */
    List<String> validateRule(String ruleName, JsonNode ruleConfiguration, JsonNode ruleSchema);
}
