package com.mapobserver.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mapobserver.core.config.EngineConfig;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.Observer;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.model.RuleConfiguration;
import com.mapobserver.core.rule.InvalidRuleConfigurationException;
import com.mapobserver.core.rule.ObserverRule;
import com.mapobserver.core.rule.RuleApplicationUnit;
import com.mapobserver.core.rule.RuleRegistry;
import com.mapobserver.core.rule.StatefulObserverRule;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;
import com.mapobserver.core.spi.GeoObjectSource;
import com.mapobserver.core.spi.ObserverStore;
import com.mapobserver.core.validation.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the geo-objects an observer may see by running its configured
 * rules.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>An observer without rules gets every active object of its map.</li>
 * <li>The configuration is checked structurally. A broken configuration is
 * logged and answered with the same default result.</li>
 * <li>Each configured rule is resolved, its state advanced when stateful,
 * and its slice validated against its own schema. A rule that is unknown,
 * invalid or throws is skipped without affecting the others.</li>
 * <li>Changed state is written back through the {@link ObserverStore}.</li>
 * <li>Rules narrow the query in priority order, then filter its result in
 * the same order.</li>
 * </ol>
 *
 * <h3>Errors</h3>
 * <p>
 * Only {@link StatePersistenceException} escapes. Losing a state update
 * would silently reset request and time budgets, so it is never swallowed.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The engine holds no per-call state. Concurrent calls for different
 * observers are independent; concurrent calls for the same observer race on
 * the stored state and may overshoot a budget.
 * </p>
 *
 * @since 1.0.0
 */
public class ObserverRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ObserverRuleEngine.class);

    /** Name of the query parameter bound to the observer's map. */
    static final String MAP_PARAMETER = "map";

    private final GeoObjectSource objectSource;
    private final ObserverStore observerStore;
    private final RuleRegistry registry;
    private final RuleValidator validator;
    private final EngineConfig config;

    public ObserverRuleEngine(GeoObjectSource objectSource, ObserverStore observerStore,
            RuleRegistry registry, RuleValidator validator) {
        this(objectSource, observerStore, registry, validator, EngineConfig.defaults());
    }

    /**
     * @param objectSource  source of geo-objects; must not be {@code null}
     * @param observerStore persistence for updated rule state; must not be
     *                      {@code null}
     * @param registry      rule registry; must not be {@code null}
     * @param validator     configuration validator; must not be {@code null}
     * @param config        engine configuration; must not be {@code null}
     */
    public ObserverRuleEngine(GeoObjectSource objectSource, ObserverStore observerStore,
            RuleRegistry registry, RuleValidator validator, EngineConfig config) {
        this.objectSource = Objects.requireNonNull(objectSource, "GeoObjectSource must not be null");
        this.observerStore = Objects.requireNonNull(observerStore, "ObserverStore must not be null");
        this.registry = Objects.requireNonNull(registry, "RuleRegistry must not be null");
        this.validator = Objects.requireNonNull(validator, "RuleValidator must not be null");
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Return the objects {@code observer} is allowed to see.
     *
     * @param observer the observer; must not be {@code null}
     * @return unmodifiable list of visible objects
     * @throws StatePersistenceException if updated rule state could not be
     *                                   saved
     */
    public List<GeoObject> getFilteredObjects(Observer observer) {
        Objects.requireNonNull(observer, "Observer must not be null");

        RuleConfiguration configuration = observer.getRules();
        if (configuration == null || configuration.isEmpty()) {
            LOG.debug("Observer {} has no rules, returning all active objects", observer.getId());
            return defaultObjects(observer);
        }

        List<RuleApplicationUnit> units;
        try {
            units = prepareUnits(observer, configuration);
        } catch (InvalidRuleConfigurationException e) {
            LOG.atError()
                    .addKeyValue("observer", observer.getId())
                    .addKeyValue("observerName", observer.getName())
                    .addKeyValue("errors", e.getValidationErrors())
                    .log("Invalid rule configuration, using default behavior");
            return defaultObjects(observer);
        }

        List<GeoObject> result = applyRules(observer, units);

        LOG.atInfo()
                .addKeyValue("observer", observer.getId())
                .addKeyValue("rules", units.stream().map(RuleApplicationUnit::getRuleName).toList())
                .addKeyValue("objects", result.size())
                .log("Rules applied successfully");
        return result;
    }

    // ---------------------------------------------------------------
    // Rule preparation
    // ---------------------------------------------------------------

    private List<RuleApplicationUnit> prepareUnits(Observer observer, RuleConfiguration configuration) {
        Map<String, RuleConfig> candidates = new LinkedHashMap<>();
        Map<String, ObserverRule> resolved = new LinkedHashMap<>();

        if (config.isStrictValidation()) {
            // Whole configuration against the aggregate schema; unknown names fail here
            for (RuleApplicationUnit unit : registry.createFromConfig(configuration)) {
                candidates.put(unit.getRuleName(), unit.getConfig());
                resolved.put(unit.getRuleName(), unit.getRule());
            }
        } else {
            List<String> errors = validator.validateStructure(configuration.toJson());
            if (!errors.isEmpty()) {
                throw new InvalidRuleConfigurationException(errors);
            }
            candidates.putAll(configuration.asMap());
        }

        Map<String, ObjectNode> stateChanges = new LinkedHashMap<>();
        List<RuleApplicationUnit> units = new ArrayList<>();

        for (Map.Entry<String, RuleConfig> candidate : candidates.entrySet()) {
            String ruleName = candidate.getKey();
            try {
                ObserverRule rule = resolved.containsKey(ruleName)
                        ? resolved.get(ruleName)
                        : registry.get(ruleName).orElse(null);
                if (rule == null) {
                    LOG.atWarn()
                            .addKeyValue("observer", observer.getId())
                            .addKeyValue("rule", ruleName)
                            .log("Rule not found, skipping");
                    continue;
                }
                prepareUnit(observer, ruleName, rule, candidate.getValue(), stateChanges)
                        .ifPresent(units::add);
            } catch (RuntimeException e) {
                LOG.atError()
                        .addKeyValue("observer", observer.getId())
                        .addKeyValue("rule", ruleName)
                        .setCause(e)
                        .log("Failed to process rule, skipping");
            }
        }

        if (!stateChanges.isEmpty()) {
            persistState(observer, stateChanges);
        }

        units.sort(Comparator.comparingInt(RuleApplicationUnit::getPriority));
        return units;
    }

    private Optional<RuleApplicationUnit> prepareUnit(Observer observer, String ruleName, ObserverRule rule,
            RuleConfig ruleConfig, Map<String, ObjectNode> stateChanges) {
        RuleConfig current = ruleConfig;
        boolean stateChanged = false;

        if (rule instanceof StatefulObserverRule stateful) {
            if (!current.hasState()) {
                current = current.withState(stateful.initializeState(current));
                stateChanged = true;
            }
            ObjectNode prior = current.getState().orElseThrow();
            ObjectNode next = stateful.updateState(current);
            current = current.advance(next);
            if (!next.equals(prior)) {
                stateChanged = true;
            }
        }

        List<String> errors = validator.validateRule(ruleName, current.toJson(), rule.getConfigSchema());
        if (!errors.isEmpty()) {
            LOG.atWarn()
                    .addKeyValue("observer", observer.getId())
                    .addKeyValue("rule", ruleName)
                    .addKeyValue("errors", errors)
                    .log("Rule configuration invalid, skipping");
            return Optional.empty();
        }

        if (stateChanged) {
            stateChanges.put(ruleName, current.getState().orElseThrow());
        }
        return Optional.of(new RuleApplicationUnit(rule, current));
    }

    // ---------------------------------------------------------------
    // State persistence
    // ---------------------------------------------------------------

    private void persistState(Observer observer, Map<String, ObjectNode> stateChanges) {
        try {
            observerStore.beginTransaction();
            observerStore.refresh(observer);
            RuleConfiguration updated = observer.getRules().withStates(stateChanges);
            observer.setRules(updated);
            observerStore.replaceRules(observer, updated);
            observerStore.commit();
            LOG.debug("Persisted state of {} rule(s) for observer {}", stateChanges.size(), observer.getId());
        } catch (RuntimeException e) {
            try {
                observerStore.rollback();
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            LOG.atError()
                    .addKeyValue("observer", observer.getId())
                    .addKeyValue("rules", stateChanges.keySet())
                    .setCause(e)
                    .log("Failed to persist rule state");
            throw new StatePersistenceException(
                    "Failed to persist rule state for observer " + observer.getId(), e);
        }
    }

    // ---------------------------------------------------------------
    // Query and memory phases
    // ---------------------------------------------------------------

    private List<GeoObject> applyRules(Observer observer, List<RuleApplicationUnit> units) {
        GeoObjectQuery query = objectSource.createQuery()
                .where(Criterion.mapIs(MAP_PARAMETER))
                .andWhere(Criterion.active())
                .setParameter(MAP_PARAMETER, observer.getMapId());
        for (RuleApplicationUnit unit : units) {
            query = unit.getRule().applyToQuery(query, unit.getConfig());
        }

        List<GeoObject> objects = query.execute();
        LOG.debug("Query phase returned {} object(s) for observer {}", objects.size(), observer.getId());

        for (RuleApplicationUnit unit : units) {
            objects = unit.getRule().applyToObjects(objects, unit.getConfig());
        }
        LOG.debug("Memory phase kept {} object(s) for observer {}", objects.size(), observer.getId());
        return List.copyOf(objects);
    }

    private List<GeoObject> defaultObjects(Observer observer) {
        return List.copyOf(objectSource.findActiveByMap(observer.getMapId()));
    }
}
