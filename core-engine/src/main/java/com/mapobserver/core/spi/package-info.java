/**
 * Interfaces of the collaborators the rule engine depends on.
 *
 * <p>
 * The engine never talks to a database directly. It composes a
 * {@link com.mapobserver.core.spi.GeoObjectQuery} obtained from a
 * {@link com.mapobserver.core.spi.GeoObjectSource}, and persists rule state
 * through an {@link com.mapobserver.core.spi.ObserverStore}. The
 * {@code memory-store} module ships in-memory implementations.
 * </p>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.spi;
