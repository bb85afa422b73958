package com.mapobserver.memory;

import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link GeoObjectQuery} evaluated over an in-memory list.
 *
 * <p>
 * Criteria and parameters are recorded as they are added and only evaluated
 * by {@link #execute()}. Every parameter a criterion refers to must be bound
 * by then.
 * </p>
 */
public class InMemoryGeoObjectQuery implements GeoObjectQuery {

    private final List<GeoObject> objects;
    private final Clock clock;

    private final List<Criterion> criteria = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    InMemoryGeoObjectQuery(List<GeoObject> objects, Clock clock) {
        this.objects = objects;
        this.clock = clock;
    }

    @Override
    public GeoObjectQuery where(Criterion criterion) {
        Objects.requireNonNull(criterion, "Criterion must not be null");
        criteria.clear();
        criteria.add(criterion);
        return this;
    }

    @Override
    public GeoObjectQuery andWhere(Criterion criterion) {
        criteria.add(Objects.requireNonNull(criterion, "Criterion must not be null"));
        return this;
    }

    @Override
    public GeoObjectQuery setParameter(String name, Object value) {
        parameters.put(Objects.requireNonNull(name, "Parameter name must not be null"), value);
        return this;
    }

    /**
     * @return unmodifiable view of the criteria in the order they were added
     */
    public List<Criterion> getCriteria() {
        return Collections.unmodifiableList(criteria);
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * @throws IllegalStateException if a criterion refers to an unbound
     *                               parameter or a parameter has the wrong
     *                               type
     */
    @Override
    public List<GeoObject> execute() {
        Instant now = clock.instant();
        List<Matcher> matchers = criteria.stream().map(this::compile).toList();
        return objects.stream()
                .filter(object -> matchers.stream().allMatch(matcher -> matcher.matches(object, now)))
                .toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Matcher {
        boolean matches(GeoObject object, Instant now);
    }

    private Matcher compile(Criterion criterion) {
        return switch (criterion.getKind()) {
            case MAP_IS -> {
                long mapId = toLong(bound(criterion), criterion);
                yield (object, now) -> object.getMapId() == mapId;
            }
            case ACTIVE -> (object, now) -> object.isActiveAt(now);
            case ID_IN -> {
                Set<Long> ids = toLongs(bound(criterion), criterion);
                yield (object, now) -> ids.contains(object.getId());
            }
            case SIDE_ID_IN -> {
                Set<Long> ids = toLongs(bound(criterion), criterion);
                yield (object, now) -> object.getSideId().map(ids::contains).orElse(false);
            }
            case NONE -> (object, now) -> false;
        };
    }

    private Object bound(Criterion criterion) {
        String name = criterion.getParameter()
                .orElseThrow(() -> new IllegalStateException("Criterion has no parameter: " + criterion));
        if (!parameters.containsKey(name)) {
            throw new IllegalStateException("Parameter not bound: :" + name + " in " + criterion);
        }
        return parameters.get(name);
    }

    private static long toLong(Object value, Criterion criterion) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Expected a number for " + criterion + ", got: " + value);
    }

    private static Set<Long> toLongs(Object value, Criterion criterion) {
        if (value instanceof Collection<?> values) {
            Set<Long> ids = new HashSet<>();
            for (Object element : values) {
                ids.add(toLong(element, criterion));
            }
            return ids;
        }
        return Set.of(toLong(value, criterion));
    }

    @Override
    public String toString() {
        return "SELECT g FROM GeoObject g WHERE "
                + criteria.stream().map(Criterion::toString).collect(Collectors.joining(" AND "));
    }
}
