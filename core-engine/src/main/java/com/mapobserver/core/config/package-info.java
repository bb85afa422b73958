/**
 * Engine configuration and loading of rule configurations.
 *
 * <p>
 * {@link com.mapobserver.core.config.EngineConfig} is resolved from the
 * environment; {@link com.mapobserver.core.config.RuleConfigurationLoader}
 * reads rule configurations from JSON or YAML and fails fast on malformed
 * input.
 * </p>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.config;
