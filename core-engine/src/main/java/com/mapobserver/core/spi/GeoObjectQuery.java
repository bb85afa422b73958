package com.mapobserver.core.spi;

import com.mapobserver.core.model.GeoObject;

import java.util.List;

/**
 * Composable query over the geo-objects of the backing store.
 *
 * <p>
 * All builder methods return the query itself so calls can be chained.
 * Criteria are combined conjunctively. Nothing is read from the store
 * before {@link #execute()}.
 * </p>
 *
 * @since 1.0.0
 */
public interface GeoObjectQuery {

    /**
     * Replace all criteria with {@code criterion}.
     *
     * @param criterion the criterion; must not be {@code null}
     * @return this query
     */
    GeoObjectQuery where(Criterion criterion);

    /**
     * Add {@code criterion} to the existing criteria.
     *
     * @param criterion the criterion; must not be {@code null}
     * @return this query
     */
    GeoObjectQuery andWhere(Criterion criterion);

    /**
     * Bind a named parameter referenced by a criterion.
     *
     * @param name  parameter name; must not be {@code null}
     * @param value parameter value
     * @return this query
     */
    GeoObjectQuery setParameter(String name, Object value);

    /**
     * Run the query.
     *
     * @return matching objects
     */
    List<GeoObject> execute();
}
