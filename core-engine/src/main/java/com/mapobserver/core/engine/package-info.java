/**
 * Orchestration of rule evaluation for a single observer.
 *
 * <p>
 * {@link com.mapobserver.core.engine.ObserverRuleEngine} is the entry point
 * callers use; everything else in the engine is reached through it.
 * </p>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.engine;
