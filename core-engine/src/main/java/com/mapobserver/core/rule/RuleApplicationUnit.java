package com.mapobserver.core.rule;

import com.mapobserver.core.model.RuleConfig;

import java.util.Objects;

/**
 * A rule paired with the configuration slice it runs with during one
 * filtering request. Never persisted.
 */
public final class RuleApplicationUnit {

    private final ObserverRule rule;
    private final RuleConfig config;
    private final int priority;

    /**
     * @param rule   the rule; must not be {@code null}
     * @param config the slice; must not be {@code null}
     */
    public RuleApplicationUnit(ObserverRule rule, RuleConfig config) {
        this.rule = Objects.requireNonNull(rule, "Rule must not be null");
        this.config = Objects.requireNonNull(config, "Rule config must not be null");
        this.priority = rule.getPriority();
    }

    public ObserverRule getRule() {
        return rule;
    }

    public RuleConfig getConfig() {
        return config;
    }

    public int getPriority() {
        return priority;
    }

    public String getRuleName() {
        return rule.getName();
    }

    @Override
    public String toString() {
        return "RuleApplicationUnit{rule=" + rule.getName() + ", priority=" + priority + '}';
    }
}
