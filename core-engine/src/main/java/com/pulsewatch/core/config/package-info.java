/**
 * Configuration loading and validation for Pulsewatch.
 *
 * <p>
 * Engine settings and rules are defined in YAML and loaded by
 * {@link com.pulsewatch.core.config.RulesLoader} into a
 * {@link com.pulsewatch.core.config.RulesConfig} instance. Validation is
 * performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.config;
