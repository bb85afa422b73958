package com.mapobserver.core.spi;

import com.mapobserver.core.model.GeoObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double for {@link GeoObjectQuery}: records what rules add and
 * returns a canned result, or nothing once {@link Criterion#none()} was
 * added.
 */
public class RecordingQuery implements GeoObjectQuery {

    private final List<GeoObject> results;
    private final List<Criterion> criteria = new ArrayList<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private int executions;

    public RecordingQuery() {
        this(List.of());
    }

    public RecordingQuery(List<GeoObject> results) {
        this.results = results;
    }

    @Override
    public GeoObjectQuery where(Criterion criterion) {
        criteria.clear();
        criteria.add(criterion);
        return this;
    }

    @Override
    public GeoObjectQuery andWhere(Criterion criterion) {
        criteria.add(criterion);
        return this;
    }

    @Override
    public GeoObjectQuery setParameter(String name, Object value) {
        parameters.put(name, value);
        return this;
    }

    @Override
    public List<GeoObject> execute() {
        executions++;
        return criteria.contains(Criterion.none()) ? List.of() : results;
    }

    public List<Criterion> getCriteria() {
        return criteria;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public int getExecutions() {
        return executions;
    }
}
