package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.config.EngineConfig;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.model.RuleConfiguration;
import com.mapobserver.core.validation.RuleConfigValidator;
import com.mapobserver.core.validation.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Table of every rule known to the process, indexed by name.
 *
 * <p>
 * Built once at startup and read-only afterwards, so a single instance can
 * be shared by all threads. This is the single point of extension when
 * adding new rules: implement {@link ObserverRule} and add the instance to
 * {@link #builtIn(EngineConfig, Clock, RuleValidator)}.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * {@link #all()} and {@link #createFromConfig(RuleConfiguration)} return
 * rules by ascending priority; rules with equal priority keep registration
 * order.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, ObserverRule> rules;
    private final RuleValidator validator;

    private volatile ObjectNode aggregateSchema;

    /**
     * @param rules     the rules to register; must not be {@code null}
     * @param validator validator used by {@link #createFromConfig}; must not be
     *                  {@code null}
     * @throws IllegalArgumentException if a rule name is empty or malformed
     * @throws IllegalStateException    if two rules share a name
     */
    public RuleRegistry(Collection<? extends ObserverRule> rules, RuleValidator validator) {
        Objects.requireNonNull(rules, "Rules must not be null");
        this.validator = Objects.requireNonNull(validator, "RuleValidator must not be null");

        Map<String, ObserverRule> indexed = new LinkedHashMap<>();
        for (ObserverRule rule : rules) {
            Objects.requireNonNull(rule, "Rule must not be null");
            String name = requireValidName(rule.getName());
            if (indexed.putIfAbsent(name, rule) != null) {
                throw new IllegalStateException("Duplicate rule name: '" + name + "'");
            }
        }

        Map<String, ObserverRule> sorted = new LinkedHashMap<>();
        indexed.values().stream()
                .sorted(Comparator.comparingInt(ObserverRule::getPriority))
                .forEach(rule -> sorted.put(rule.getName(), rule));
        this.rules = Collections.unmodifiableMap(sorted);

        LOG.info("Indexed {} rule(s): {}", this.rules.size(), this.rules.keySet());
    }

    /**
     * Build the registry of built-in rules, minus those disabled in
     * {@code config}.
     *
     * @param config    engine configuration; must not be {@code null}
     * @param clock     clock handed to time-based rules; must not be
     *                  {@code null}
     * @param validator validator; must not be {@code null}
     * @return the registry
     */
    public static RuleRegistry builtIn(EngineConfig config, Clock clock, RuleValidator validator) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");

        List<ObserverRule> enabled = Stream.<ObserverRule>of(
                        new TimeRangeRule(clock, config.getDefaultTimezone()),
                        new TimeLimitRule(clock),
                        new RequestLimitRule(clock),
                        new ObjectIdRule(),
                        new SideIdRule())
                .filter(rule -> !config.getDisabledRules().contains(rule.getName()))
                .toList();
        return new RuleRegistry(enabled, validator);
    }

    /**
     * Built-in rules with the system UTC clock and default configuration.
     *
     * @return the registry
     */
    public static RuleRegistry builtIn() {
        return builtIn(EngineConfig.defaults(), Clock.systemUTC(), new RuleConfigValidator());
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * Look up a rule. Characters outside {@code [A-Za-z0-9_]} are stripped
     * before the case-sensitive lookup.
     *
     * @param ruleName requested name; must not be {@code null}
     * @return the rule, or empty if none is registered under that name
     * @throws IllegalArgumentException if nothing usable is left after
     *                                  sanitization, or it does not start with
     *                                  a letter
     */
    public Optional<ObserverRule> get(String ruleName) {
        String sanitized = sanitize(ruleName);
        if (sanitized.isEmpty()) {
            throw new IllegalArgumentException("Invalid rule name after sanitization: " + ruleName);
        }
        if (!Character.isLetter(sanitized.charAt(0))) {
            throw new IllegalArgumentException("Rule name must start with a letter: " + sanitized);
        }

        ObserverRule rule = rules.get(sanitized);
        if (rule == null) {
            LOG.atWarn()
                    .addKeyValue("requested", ruleName)
                    .addKeyValue("sanitized", sanitized)
                    .addKeyValue("available", rules.keySet())
                    .log("Rule not found");
        }
        return Optional.ofNullable(rule);
    }

    /**
     * @param ruleName requested name
     * @return {@code true} if a rule is registered under the sanitized name
     */
    public boolean has(String ruleName) {
        if (ruleName == null) {
            return false;
        }
        String sanitized = sanitize(ruleName);
        return !sanitized.isEmpty() && rules.containsKey(sanitized);
    }

    /**
     * @return unmodifiable list of all rules by ascending priority
     */
    public List<ObserverRule> all() {
        return List.copyOf(rules.values());
    }

    /**
     * Schema accepting any combination of the registered rules: an object
     * with one property per rule, no additional properties and at least one
     * entry. Built on first use and cached.
     *
     * @return a copy of the aggregate schema
     */
    public ObjectNode aggregateSchema() {
        ObjectNode schema = aggregateSchema;
        if (schema == null) {
            synchronized (this) {
                schema = aggregateSchema;
                if (schema == null) {
                    schema = buildAggregateSchema();
                    aggregateSchema = schema;
                }
            }
        }
        return schema.deepCopy();
    }

    // ---------------------------------------------------------------
    // Materialization
    // ---------------------------------------------------------------

    /**
     * Validate a whole configuration against the aggregate schema and pair
     * each configured rule with its slice.
     *
     * <p>
     * Unknown rule names are rejected by the aggregate schema, which allows
     * no additional properties.
     * </p>
     *
     * @param configuration the configuration; must not be {@code null}
     * @return units sorted by ascending priority
     * @throws InvalidRuleConfigurationException if validation fails
     */
    public List<RuleApplicationUnit> createFromConfig(RuleConfiguration configuration) {
        Objects.requireNonNull(configuration, "Rule configuration must not be null");

        List<String> errors = validator.validate(configuration.toJson(), aggregateSchema());
        if (!errors.isEmpty()) {
            throw new InvalidRuleConfigurationException(errors);
        }

        List<RuleApplicationUnit> units = new ArrayList<>();
        for (Map.Entry<String, RuleConfig> entry : configuration.asMap().entrySet()) {
            Optional<ObserverRule> rule = get(entry.getKey());
            if (rule.isPresent()) {
                units.add(new RuleApplicationUnit(rule.get(), entry.getValue()));
            } else {
                LOG.warn("Rule not found during creation: {} (available: {})",
                        entry.getKey(), rules.keySet());
            }
        }
        units.sort(Comparator.comparingInt(RuleApplicationUnit::getPriority));

        LOG.info("Created {} rule(s) from configuration: {}", units.size(),
                units.stream().map(RuleApplicationUnit::getRuleName).toList());
        return List.copyOf(units);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ObjectNode buildAggregateSchema() {
        ObjectNode properties = JsonNodeFactory.instance.objectNode();
        rules.forEach((name, rule) -> {
            JsonNode ruleSchema = rule.getConfigSchema();
            properties.set(name, ruleSchema != null ? ruleSchema : JsonNodeFactory.instance.objectNode());
        });

        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        schema.set("properties", properties);
        schema.put("additionalProperties", false);
        schema.put("minProperties", 1);

        LOG.debug("Built aggregate schema for {} rule(s)", properties.size());
        return schema;
    }

    private static String requireValidName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Rule name must not be empty");
        }
        if (!Character.isLetter(name.charAt(0))) {
            throw new IllegalArgumentException("Rule name must start with a letter: " + name);
        }
        if (!RuleConfigValidator.RULE_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid rule name format: " + name);
        }
        return name;
    }

    private static String sanitize(String ruleName) {
        Objects.requireNonNull(ruleName, "Rule name must not be null");
        return ruleName.replaceAll("[^a-zA-Z0-9_]", "");
    }
}
