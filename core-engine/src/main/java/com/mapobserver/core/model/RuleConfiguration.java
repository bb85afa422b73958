package com.mapobserver.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-observer rule configuration: an ordered mapping from rule name to
 * that rule's {@link RuleConfig} slice.
 *
 * <p>
 * Expected JSON structure:
 * </p>
 *
 * <pre>
 * {
 *   "ObjectIdRule": [1, 2, 3],
 *   "request_limit": { "limit": 10, "_state": { "remaining": 7, ... } }
 * }
 * </pre>
 *
 * <p>
 * Instances are immutable; every "with" method returns a new configuration.
 * Key order is preserved from the source document.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfiguration {

    private static final RuleConfiguration EMPTY = new RuleConfiguration(new LinkedHashMap<>());

    private final Map<String, RuleConfig> rules;

    private RuleConfiguration(LinkedHashMap<String, RuleConfig> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static RuleConfiguration empty() {
        return EMPTY;
    }

    /**
     * Build a configuration from its JSON representation.
     *
     * @param json a JSON object; {@code null} or JSON {@code null} yields the
     *             empty configuration
     * @return the parsed configuration
     * @throws IllegalArgumentException if {@code json} is not a JSON object
     */
    public static RuleConfiguration fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return EMPTY;
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException(
                    "Rule configuration must be a JSON object, got: " + json.getNodeType());
        }
        LinkedHashMap<String, RuleConfig> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            parsed.put(field.getKey(), RuleConfig.fromJson(field.getValue()));
        }
        return new RuleConfiguration(parsed);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    public Set<String> getRuleNames() {
        return rules.keySet();
    }

    public Optional<RuleConfig> get(String ruleName) {
        return Optional.ofNullable(rules.get(ruleName));
    }

    /**
     * @return unmodifiable view of all slices in document order
     */
    public Map<String, RuleConfig> asMap() {
        return rules;
    }

    /**
     * Return a copy with the slice for {@code ruleName} added or replaced.
     *
     * @param ruleName rule name; must not be {@code null}
     * @param config   the slice; must not be {@code null}
     * @return a new configuration
     */
    public RuleConfiguration with(String ruleName, RuleConfig config) {
        Objects.requireNonNull(ruleName, "Rule name must not be null");
        Objects.requireNonNull(config, "Rule config must not be null");
        LinkedHashMap<String, RuleConfig> copy = new LinkedHashMap<>(rules);
        copy.put(ruleName, config);
        return new RuleConfiguration(copy);
    }

    /**
     * Return a copy with the given states written into the matching slices.
     *
     * <p>
     * States for rules that are not part of this configuration are ignored:
     * a rule removed by someone else is not brought back.
     * </p>
     *
     * @param states rule name to new state; must not be {@code null}
     * @return a new configuration
     */
    public RuleConfiguration withStates(Map<String, ObjectNode> states) {
        Objects.requireNonNull(states, "States must not be null");
        LinkedHashMap<String, RuleConfig> copy = new LinkedHashMap<>(rules);
        states.forEach((ruleName, state) -> {
            RuleConfig current = copy.get(ruleName);
            if (current != null) {
                copy.put(ruleName, current.withState(state));
            }
        });
        return new RuleConfiguration(copy);
    }

    /**
     * Serialize to the wire format.
     *
     * @return a new JSON object
     */
    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        rules.forEach((name, config) -> json.set(name, config.toJson()));
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleConfiguration that))
            return false;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
