/**
 * In-memory implementations of the engine's storage collaborators.
 *
 * <p>
 * {@link com.mapobserver.memory.InMemoryGeoObjectRepository} serves
 * geo-objects and evaluates queries over them;
 * {@link com.mapobserver.memory.InMemoryObserverStore} keeps observer rule
 * configurations with thread-bound, version-checked transactions. Used for
 * embedding the engine without a database and for end-to-end tests.
 * </p>
 *
 * @since 1.0.0
 */
package com.mapobserver.memory;
