package com.mapobserver.core.spi;

import com.mapobserver.core.model.GeoObject;

import java.util.List;

/**
 * Access to the geo-objects of the backing store.
 *
 * @since 1.0.0
 */
public interface GeoObjectSource {

    /**
     * Start a new, empty query.
     *
     * @return a fresh query builder
     */
    GeoObjectQuery createQuery();

    /**
     * Default view of a map: every active, non-expired object on it.
     *
     * @param mapId map identifier
     * @return the active objects
     */
    List<GeoObject> findActiveByMap(long mapId);
}
