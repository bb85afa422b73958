package com.mapobserver.core.rule;

import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.spi.Criterion;

import java.util.Optional;

/**
 * Shows only the objects whose ids are listed.
 *
 * <pre>
 * "ObjectIdRule": [12, 15, 42]
 * </pre>
 *
 * <p>
 * Cheap and highly selective, so it runs early (priority 50).
 * </p>
 */
public class ObjectIdRule extends AllowListRule {

    static final String PARAMETER = "allowedIds";

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    protected String parameterName() {
        return PARAMETER;
    }

    @Override
    protected Criterion criterion() {
        return Criterion.idIn(PARAMETER);
    }

    @Override
    protected Optional<Long> idOf(GeoObject object) {
        return Optional.of(object.getId());
    }
}
