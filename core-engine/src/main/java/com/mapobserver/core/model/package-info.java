/**
 * Domain model classes for the observer rule engine.
 *
 * <p>
 * This package contains the values shared between the engine and its
 * collaborators:
 * </p>
 * <ul>
 * <li>{@link com.mapobserver.core.model.GeoObject}: a filterable map
 * object</li>
 * <li>{@link com.mapobserver.core.model.Observer}: a read-only viewer with
 * its rule configuration</li>
 * <li>{@link com.mapobserver.core.model.RuleConfiguration}: rule name to
 * configuration mapping</li>
 * <li>{@link com.mapobserver.core.model.RuleConfig}: one rule's parameters
 * and engine-managed state</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.model;
