package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.spi.GeoObjectQuery;

import java.util.List;

/**
 * Contract for all observer rules.
 *
 * <p>
 * A rule filters in two phases. {@link #applyToQuery} contributes criteria to
 * the store query; {@link #applyToObjects} refines the query result in
 * memory. Both phases receive the same {@link RuleConfig}. Rules that cannot
 * be expressed at query level keep the no-op default of
 * {@code applyToQuery}.
 * </p>
 * <p>
 * Rules are immutable singletons shared by all observers and threads; all
 * per-observer data arrives through the {@code config} argument.
 * </p>
 */
public interface ObserverRule {

    /**
     * Return the unique name of this rule, used as its configuration key.
     *
     * @return rule name matching {@code ^[A-Za-z][A-Za-z0-9_]*$}
     */
    String getName();

    /**
     * Lower values are applied first.
     *
     * @return rule priority
     */
    int getPriority();

    /**
     * Return the JSON schema describing this rule's configuration slice.
     * Depends only on the rule type.
     *
     * @return the schema
     */
    JsonNode getConfigSchema();

    /**
     * Contribute criteria to the store query.
     *
     * @param query  the query built so far
     * @param config this rule's configuration slice
     * @return the query to continue with
     */
    default GeoObjectQuery applyToQuery(GeoObjectQuery query, RuleConfig config) {
        return query;
    }

    /**
     * Filter the query result in memory. Always invoked, after the query
     * phase. Must be deterministic for a given config and must not modify
     * {@code objects}.
     *
     * @param objects the objects that survived the previous rules
     * @param config  this rule's configuration slice
     * @return the objects to keep
     */
    default List<GeoObject> applyToObjects(List<GeoObject> objects, RuleConfig config) {
        return objects;
    }
}
