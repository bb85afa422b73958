package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared logic of the allow-list rules, configured with a bare JSON array of
 * identifiers.
 *
 * <p>
 * Entries that are not positive integers (numeric strings are accepted) are
 * discarded before filtering. When no valid entry remains the rule does
 * nothing in either phase.
 * </p>
 */
abstract class AllowListRule extends AbstractObserverRule {

    @Override
    public GeoObjectQuery applyToQuery(GeoObjectQuery query, RuleConfig config) {
        Set<Long> allowed = allowedIds(config);
        if (allowed.isEmpty()) {
            return query;
        }
        return query
                .andWhere(criterion())
                .setParameter(parameterName(), allowed);
    }

    @Override
    public List<GeoObject> applyToObjects(List<GeoObject> objects, RuleConfig config) {
        Set<Long> allowed = allowedIds(config);
        if (allowed.isEmpty()) {
            return objects;
        }
        return objects.stream()
                .filter(object -> idOf(object).map(allowed::contains).orElse(false))
                .toList();
    }

    /** Name of the query parameter holding the allowed ids. */
    protected abstract String parameterName();

    /** Criterion restricting the query to the allowed ids. */
    protected abstract Criterion criterion();

    /** The identifier of {@code object} this rule filters on. */
    protected abstract Optional<Long> idOf(GeoObject object);

    /**
     * Extract the valid, deduplicated ids of the slice in document order.
     *
     * @param config the rule slice
     * @return unmodifiable set of positive ids
     */
    static Set<Long> allowedIds(RuleConfig config) {
        JsonNode list = config.getParameters();
        if (!list.isArray()) {
            return Collections.emptySet();
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (JsonNode entry : list) {
            toPositiveId(entry).ifPresent(ids::add);
        }
        return Collections.unmodifiableSet(ids);
    }

    private static Optional<Long> toPositiveId(JsonNode entry) {
        long id;
        if (entry.isNumber() && entry.canConvertToExactIntegral() && entry.canConvertToLong()) {
            id = entry.asLong();
        } else if (entry.isTextual() && entry.asText().trim().matches("\\d{1,18}")) {
            id = Long.parseLong(entry.asText().trim());
        } else {
            return Optional.empty();
        }
        return id > 0 ? Optional.of(id) : Optional.empty();
    }
}
