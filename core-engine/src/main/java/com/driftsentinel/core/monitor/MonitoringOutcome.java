package com.driftsentinel.core.monitor;

import com.driftsentinel.core.error.MonitoringException;
import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.DriftReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one monitoring run.
 *
 * <p>
 * A run that failed while publishing still carries its report:
 * {@link #getReport()} is present and {@link #isMetricsDelivered()} is
 * {@code false}. A run that failed earlier has no report.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringOutcome {

    /** Process exit code for a completed run. */
    public static final int EXIT_COMPLETED = 0;
    /** Process exit code when data could not be loaded or detection failed. */
    public static final int EXIT_RUN_FAILED = 1;
    /** Process exit code when the report was computed but not published. */
    public static final int EXIT_PUBLISH_FAILED = 2;

    private final String modelId;
    private final String environment;
    private final RunState state;
    private final RunState failedStage;
    private final DriftReport report;
    private final MonitoringException failure;

    private MonitoringOutcome(String modelId, String environment, RunState state, RunState failedStage,
            DriftReport report, MonitoringException failure) {
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.state = state;
        this.failedStage = failedStage;
        this.report = report;
        this.failure = failure;
    }

    static MonitoringOutcome completed(String modelId, String environment, DriftReport report) {
        return new MonitoringOutcome(modelId, environment, RunState.COMPLETED, null,
                Objects.requireNonNull(report, "report must not be null"), null);
    }

    static MonitoringOutcome failed(String modelId, String environment, RunState stage,
            DriftReport report, MonitoringException failure) {
        return new MonitoringOutcome(modelId, environment, RunState.FAILED,
                Objects.requireNonNull(stage, "stage must not be null"), report,
                Objects.requireNonNull(failure, "failure must not be null"));
    }

    public String getModelId() {
        return modelId;
    }

    public String getEnvironment() {
        return environment;
    }

    /**
     * @return {@link RunState#COMPLETED} or {@link RunState#FAILED}
     */
    public RunState getState() {
        return state;
    }

    /**
     * @return the state the run was in when it failed, empty if it completed
     */
    public Optional<RunState> getFailedStage() {
        return Optional.ofNullable(failedStage);
    }

    public Optional<DriftReport> getReport() {
        return Optional.ofNullable(report);
    }

    public Optional<MonitoringException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isCompleted() {
        return state == RunState.COMPLETED;
    }

    /**
     * @return {@code true} only if the run reached {@link RunState#COMPLETED}
     */
    public boolean isMetricsDelivered() {
        return state == RunState.COMPLETED;
    }

    /**
     * @return which detectors fired, or why the run failed
     */
    public String summary() {
        if (state == RunState.COMPLETED) {
            return "Monitoring completed. " + report.summary();
        }
        if (failure instanceof PublishException) {
            return "Metrics not delivered (" + failure.getMessage() + "). " + report.summary();
        }
        return "Monitoring failed during " + failedStage + ": " + failure.getMessage();
    }

    /**
     * @return {@value #EXIT_COMPLETED}, {@value #EXIT_RUN_FAILED} or
     *         {@value #EXIT_PUBLISH_FAILED}
     */
    public int exitCode() {
        if (state == RunState.COMPLETED) {
            return EXIT_COMPLETED;
        }
        return failure instanceof PublishException ? EXIT_PUBLISH_FAILED : EXIT_RUN_FAILED;
    }

    @Override
    public String toString() {
        return "MonitoringOutcome{" +
                "modelId='" + modelId + '\'' +
                ", environment='" + environment + '\'' +
                ", state=" + state +
                ", failedStage=" + failedStage +
                ", failure=" + (failure != null ? failure.getClass().getSimpleName() : null) +
                '}';
    }
}
