package com.driftsentinel.core.monitor;

import com.driftsentinel.core.detection.DetectorSuite;
import com.driftsentinel.core.detection.DriftReportAggregator;
import com.driftsentinel.core.error.DataSourceException;
import com.driftsentinel.core.error.DetectionException;
import com.driftsentinel.core.error.MonitoringException;
import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftResult;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.model.MonitoringSnapshot;
import com.driftsentinel.core.publish.MetricsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives one monitoring run for a {@code (modelId, environment)} pair.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>{@link RunState#INITIALIZING}: fetch the snapshot from the
 * {@link DriftDataSource}</li>
 * <li>{@link RunState#DETECTING}: data, concept and prediction drift, then
 * aggregation</li>
 * <li>{@link RunState#PUBLISHING}: emit metrics through the
 * {@link MetricsPublisher}</li>
 * </ol>
 * <p>
 * A data-source or detection failure ends the run before anything is
 * published. A publish failure ends the run as {@link RunState#FAILED} but
 * the outcome keeps the report, so delivery can be retried without
 * recomputing drift.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * The orchestrator keeps no per-run state and may serve parallel runs for
 * different models. When built with an {@link Executor} the three detections
 * of a run execute concurrently; the first failure cancels the others and is
 * rethrown unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringOrchestrator.class);

    private final DriftDataSource dataSource;
    private final DetectorSuite detectors;
    private final MetricsPublisher publisher;
    private final Duration dataSourceTimeout;
    private final Executor detectionExecutor;

    /**
     * Create an orchestrator that runs detections sequentially.
     */
    public MonitoringOrchestrator(DriftDataSource dataSource, DetectorSuite detectors,
            MetricsPublisher publisher, Duration dataSourceTimeout) {
        this(dataSource, detectors, publisher, dataSourceTimeout, null);
    }

    /**
     * @param dataSource        snapshot provider; must not be {@code null}
     * @param detectors         detector per drift type; must not be
     *                          {@code null}
     * @param publisher         metric publisher; must not be {@code null}
     * @param dataSourceTimeout bound passed to every fetch; must be positive
     * @param detectionExecutor executor for concurrent detection, or
     *                          {@code null} to detect sequentially
     */
    public MonitoringOrchestrator(DriftDataSource dataSource, DetectorSuite detectors,
            MetricsPublisher publisher, Duration dataSourceTimeout, Executor detectionExecutor) {
        this.dataSource = Objects.requireNonNull(dataSource, "DriftDataSource must not be null");
        this.detectors = Objects.requireNonNull(detectors, "DetectorSuite must not be null");
        this.publisher = Objects.requireNonNull(publisher, "MetricsPublisher must not be null");
        this.dataSourceTimeout = Objects.requireNonNull(dataSourceTimeout, "dataSourceTimeout must not be null");
        if (dataSourceTimeout.isNegative() || dataSourceTimeout.isZero()) {
            throw new IllegalArgumentException("dataSourceTimeout must be positive, got: " + dataSourceTimeout);
        }
        this.detectionExecutor = detectionExecutor;
    }

    /**
     * Execute one monitoring run.
     *
     * <p>
     * Typed {@link MonitoringException}s become a {@link RunState#FAILED}
     * outcome. Anything else (invalid arguments, programming errors)
     * propagates.
     * </p>
     *
     * @param modelId     model identifier; must not be blank
     * @param environment deployment environment; must not be blank
     * @return the terminal outcome
     */
    public MonitoringOutcome run(String modelId, String environment) {
        requireNonBlank(modelId, "modelId");
        requireNonBlank(environment, "environment");
        LOG.info("Starting monitoring for model {} in {}", modelId, environment);

        // 1. Initializing
        MonitoringSnapshot snapshot;
        try {
            snapshot = fetchSnapshot(modelId, environment);
        } catch (DataSourceException e) {
            return fail(modelId, environment, RunState.INITIALIZING, null, e);
        }

        // 2. Detecting
        transition(modelId, RunState.INITIALIZING, RunState.DETECTING);
        DriftReport report;
        try {
            report = detectionExecutor != null ? detectConcurrently(snapshot) : detectSequentially(snapshot);
        } catch (DetectionException e) {
            return fail(modelId, environment, RunState.DETECTING, null, e);
        }

        // 3. Publishing
        transition(modelId, RunState.DETECTING, RunState.PUBLISHING);
        try {
            publisher.publish(report, modelId);
        } catch (PublishException e) {
            return fail(modelId, environment, RunState.PUBLISHING, report, e);
        }

        transition(modelId, RunState.PUBLISHING, RunState.COMPLETED);
        MonitoringOutcome outcome = MonitoringOutcome.completed(modelId, environment, report);
        LOG.info(outcome.summary());
        return outcome;
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    private MonitoringSnapshot fetchSnapshot(String modelId, String environment) {
        MonitoringSnapshot snapshot;
        try {
            snapshot = dataSource.fetch(modelId, environment, dataSourceTimeout);
        } catch (DataSourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataSourceException("Data source failed for model " + modelId + " in " + environment
                    + ": " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new DataSourceException("Data source returned no snapshot for model " + modelId
                    + " in " + environment);
        }
        LOG.debug("Fetched {}", snapshot);
        return snapshot;
    }

    private DriftReport detectSequentially(MonitoringSnapshot snapshot) {
        return DriftReportAggregator.aggregate(
                detectData(snapshot),
                detectConcept(snapshot),
                detectPrediction(snapshot));
    }

    private DriftReport detectConcurrently(MonitoringSnapshot snapshot) {
        CompletableFuture<DriftResult> data = CompletableFuture.supplyAsync(
                () -> detectData(snapshot), detectionExecutor);
        CompletableFuture<DriftResult> concept = CompletableFuture.supplyAsync(
                () -> detectConcept(snapshot), detectionExecutor);
        CompletableFuture<DriftResult> prediction = CompletableFuture.supplyAsync(
                () -> detectPrediction(snapshot), detectionExecutor);
        List<CompletableFuture<DriftResult>> tasks = List.of(data, concept, prediction);

        // completes exceptionally as soon as any detection fails
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        tasks.forEach(task -> task.whenComplete((result, error) -> {
            if (error != null) {
                firstFailure.completeExceptionally(error);
            }
        }));

        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(data, concept, prediction), firstFailure).join();
        } catch (CompletionException e) {
            tasks.forEach(task -> task.cancel(true));
            throw rethrow(e);
        }
        return DriftReportAggregator.aggregate(data.join(), concept.join(), prediction.join());
    }

    private DriftResult detectData(MonitoringSnapshot s) {
        return detectors.forType(DriftType.DATA)
                .detectDataDrift(s.getCurrent(), s.getBaseline(), s.getFeatures());
    }

    private DriftResult detectConcept(MonitoringSnapshot s) {
        return detectors.forType(DriftType.CONCEPT)
                .detectConceptDrift(s.getPredictions(), s.getActuals(), s.getBaselineAccuracy());
    }

    private DriftResult detectPrediction(MonitoringSnapshot s) {
        return detectors.forType(DriftType.PREDICTION)
                .detectPredictionDrift(s.getCurrentPredictions(), s.getBaselinePredictions());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MonitoringOutcome fail(String modelId, String environment, RunState stage,
            DriftReport report, MonitoringException failure) {
        MonitoringOutcome outcome = MonitoringOutcome.failed(modelId, environment, stage, report, failure);
        LOG.error("Monitoring run for model {} in {} failed during {}", modelId, environment, stage, failure);
        return outcome;
    }

    private static void transition(String modelId, RunState from, RunState to) {
        LOG.debug("Run [{}]: {} -> {}", modelId, from, to);
    }

    private static RuntimeException rethrow(CompletionException e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Detection failed", cause);
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
