package com.mapobserver.core.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed, immutable configuration of the observer rule engine.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults,
 * so the engine can be tuned per deployment without code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    public static final String ENV_DISABLED_RULES = "OBSERVER_RULES_DISABLED";
    public static final String ENV_DEFAULT_TIMEZONE = "OBSERVER_RULES_DEFAULT_TIMEZONE";
    public static final String ENV_RULES_CONFIG_PATH = "OBSERVER_RULES_CONFIG_PATH";
    public static final String ENV_STRICT_VALIDATION = "OBSERVER_RULES_STRICT_VALIDATION";

    private static final EngineConfig DEFAULTS = new Builder().build();

    private final Set<String> disabledRules;
    private final ZoneId defaultTimezone;
    private final String rulesConfigPath;
    private final boolean strictValidation;

    private EngineConfig(Builder b) {
        this.disabledRules = Set.copyOf(b.disabledRules);
        this.defaultTimezone = b.defaultTimezone;
        this.rulesConfigPath = b.rulesConfigPath;
        this.strictValidation = b.strictValidation;
    }

    /**
     * @return configuration with every default applied
     */
    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link EngineConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build an {@link EngineConfig} from the given variables.
     *
     * @param env variable name to value; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static EngineConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        return new Builder()
                .disabledRules(splitNames(value(env, ENV_DISABLED_RULES, "")))
                .defaultTimezone(value(env, ENV_DEFAULT_TIMEZONE, "UTC"))
                .rulesConfigPath(value(env, ENV_RULES_CONFIG_PATH, ""))
                .strictValidation(parseBoolean(ENV_STRICT_VALIDATION, value(env, ENV_STRICT_VALIDATION, "false")))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return names of built-in rules left out of the registry
     */
    public Set<String> getDisabledRules() {
        return disabledRules;
    }

    /**
     * @return zone used by {@code time_range} when a configuration names none
     */
    public ZoneId getDefaultTimezone() {
        return defaultTimezone;
    }

    /**
     * @return path of a default rule configuration file, empty if unset
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public boolean isStrictValidation() {
        return strictValidation;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     */
    public static class Builder {
        private Set<String> disabledRules = new LinkedHashSet<>();
        private ZoneId defaultTimezone = ZoneId.of("UTC");
        private String rulesConfigPath = "";
        private boolean strictValidation = false;

        public Builder disabledRules(Set<String> v) {
            this.disabledRules = new LinkedHashSet<>(Objects.requireNonNull(v, "disabledRules must not be null"));
            return this;
        }

        public Builder disableRule(String v) {
            this.disabledRules.add(v);
            return this;
        }

        public Builder defaultTimezone(ZoneId v) {
            this.defaultTimezone = v;
            return this;
        }

        /**
         * @param v a zone id such as {@code Europe/Paris}
         * @return this builder
         * @throws IllegalArgumentException if the zone id is invalid
         */
        public Builder defaultTimezone(String v) {
            try {
                this.defaultTimezone = ZoneId.of(Objects.requireNonNull(v, "defaultTimezone must not be null"));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid default timezone: " + v, e);
            }
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder strictValidation(boolean v) {
            this.strictValidation = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            Objects.requireNonNull(defaultTimezone, "defaultTimezone required");
            if (rulesConfigPath == null) {
                rulesConfigPath = "";
            }
            for (String name : disabledRules) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("Disabled rule names must not be null or blank");
                }
            }
            return new EngineConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static Set<String> splitNames(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be 'true' or 'false', got: " + value);
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "disabledRules=" + disabledRules +
                ", defaultTimezone=" + defaultTimezone +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", strictValidation=" + strictValidation +
                '}';
    }
}
