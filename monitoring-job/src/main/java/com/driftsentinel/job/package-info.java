/**
 * Batch job that runs one drift monitoring pass for a model.
 *
 * <p>
 * This package wires the core engine to its surroundings: it reads the
 * monitoring snapshot from disk, runs the orchestrator, and delivers the
 * resulting metrics to the log or a Kafka topic.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.driftsentinel.job.MonitoringJob}: main entry point</li>
 * <li>{@link com.driftsentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.driftsentinel.job.FileSnapshotDataSource}: snapshot files
 * under the data root</li>
 * <li>{@link com.driftsentinel.job.KafkaTelemetrySink}: metrics topic
 * producer</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.job;
