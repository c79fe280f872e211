/**
 * Detection settings.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.driftsentinel.core.config.MonitoringConfigLoader} into a
 * {@link com.driftsentinel.core.config.MonitoringConfig}, which is validated
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
