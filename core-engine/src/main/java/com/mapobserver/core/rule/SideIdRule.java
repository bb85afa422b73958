package com.mapobserver.core.rule;

import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.spi.Criterion;

import java.util.Optional;

/**
 * Shows only the objects owned by one of the listed sides. Objects without
 * a side are hidden.
 *
 * <pre>
 * "SideIdRule": [1, 3]
 * </pre>
 */
public class SideIdRule extends AllowListRule {

    static final String PARAMETER = "allowedSideIds";

    @Override
    public int getPriority() {
        return 75;
    }

    @Override
    protected String parameterName() {
        return PARAMETER;
    }

    @Override
    protected Criterion criterion() {
        return Criterion.sideIdIn(PARAMETER);
    }

    @Override
    protected Optional<Long> idOf(GeoObject object) {
        return object.getSideId();
    }
}
