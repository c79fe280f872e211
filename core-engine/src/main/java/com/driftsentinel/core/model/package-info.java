/**
 * Domain model for drift monitoring.
 *
 * <ul>
 * <li>{@link com.driftsentinel.core.model.Dataset}: fixed-width numeric
 * matrix</li>
 * <li>{@link com.driftsentinel.core.model.MonitoringSnapshot}: inputs of one
 * run as supplied by a data source</li>
 * <li>{@link com.driftsentinel.core.model.DriftResult} and
 * {@link com.driftsentinel.core.model.DriftReport}: detection output</li>
 * <li>{@link com.driftsentinel.core.model.Metric}: telemetry
 * measurement</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
