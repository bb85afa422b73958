package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base class supplying the common defaults of {@link ObserverRule}.
 *
 * <ul>
 * <li>name: the simple class name</li>
 * <li>priority: {@value #DEFAULT_PRIORITY}</li>
 * <li>schema: {@code schemas/<name>.schema.json} from the classpath</li>
 * </ul>
 */
public abstract class AbstractObserverRule implements ObserverRule {

    public static final int DEFAULT_PRIORITY = 100;

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public int getPriority() {
        return DEFAULT_PRIORITY;
    }

    @Override
    public JsonNode getConfigSchema() {
        return RuleSchemas.forRule(getName());
    }

    @Override
    public String toString() {
        return getName() + "{priority=" + getPriority() + '}';
    }
}
