/**
 * Monitoring run orchestration.
 *
 * <p>
 * {@link com.driftsentinel.core.monitor.MonitoringOrchestrator} wires a
 * {@link com.driftsentinel.core.monitor.DriftDataSource}, the detectors and
 * the {@link com.driftsentinel.core.publish.MetricsPublisher} together and
 * returns a {@link com.driftsentinel.core.monitor.MonitoringOutcome}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.monitor;
