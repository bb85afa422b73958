/**
 * Validation of user-authored rule configurations.
 *
 * <p>
 * {@link com.mapobserver.core.validation.RuleConfigValidator} checks the
 * structure of a configuration and delegates schema checks to
 * {@link com.mapobserver.core.validation.JsonSchemaValidator}, which
 * implements the JSON-Schema subset rule schemas are written in. Validators
 * report violations as lists of messages and never throw on bad input.
 * </p>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.validation;
