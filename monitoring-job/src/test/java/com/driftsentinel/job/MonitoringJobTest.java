package com.driftsentinel.job;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.Metric;
import com.driftsentinel.core.monitor.MonitoringOutcome;
import com.driftsentinel.core.publish.TelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link MonitoringJob} over a temporary data root.
 */
class MonitoringJobTest {

    @TempDir
    Path dataRoot;

    private JobConfig config;
    private MonitoringConfig monitoringConfig;
    private ByteArrayOutputStream stdout;
    private final List<Metric> delivered = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        FileSnapshotDataSourceTest.install(dataRoot, "fixtures/snapshot.json", "churn-v3", "prod");
        config = new JobConfig.Builder()
                .modelId("churn-v3")
                .environment("prod")
                .dataRoot(dataRoot.toString())
                .build();
        monitoringConfig = new MonitoringConfig();
        stdout = new ByteArrayOutputStream();
    }

    private int run(TelemetrySink sink) {
        return MonitoringJob.run(config, monitoringConfig, sink,
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Completed run prints the report, delivers metrics and exits 0")
    void completedRun() {
        int exitCode = run((metrics, timeout) -> delivered.addAll(metrics));

        assertThat(exitCode).isEqualTo(MonitoringOutcome.EXIT_COMPLETED);
        assertThat(output())
                .contains("\"data_drift\"", "\"concept_drift\"", "\"prediction_drift\"")
                .contains("Monitoring completed. Data drift: false, Concept drift: false, Prediction drift: false");
        assertThat(delivered).extracting(Metric::getName)
                .contains("churn-v3/data_drift_score", "churn-v3/concept_drift_current_accuracy",
                        "churn-v3/prediction_drift_baseline_mean");
    }

    @Test
    @DisplayName("Parallel detection produces the same report as sequential detection")
    void parallelDetection() {
        run((metrics, timeout) -> {
        });
        String sequential = output();

        monitoringConfig.setParallelDetection(true);
        stdout.reset();
        int exitCode = run((metrics, timeout) -> {
        });

        assertThat(exitCode).isEqualTo(MonitoringOutcome.EXIT_COMPLETED);
        assertThat(output()).isEqualTo(sequential);
    }

    @Test
    @DisplayName("Publish failure still prints the report and exits 2")
    void publishFailure() {
        int exitCode = run((metrics, timeout) -> {
            throw new PublishException("broker unreachable");
        });

        assertThat(exitCode).isEqualTo(MonitoringOutcome.EXIT_PUBLISH_FAILED);
        assertThat(output())
                .contains("\"data_drift\"")
                .contains("Metrics not delivered");
    }

    @Test
    @DisplayName("Missing snapshot fails the run with exit 1 and no report")
    void missingSnapshot() {
        config = config.withTarget("unknown-model", "prod");

        int exitCode = run((metrics, timeout) -> delivered.addAll(metrics));

        assertThat(exitCode).isEqualTo(MonitoringOutcome.EXIT_RUN_FAILED);
        assertThat(output())
                .doesNotContain("\"data_drift\"")
                .contains("Monitoring failed during INITIALIZING");
        assertThat(delivered).isEmpty();
    }

    @Test
    @DisplayName("Tighter prediction threshold flags the fixture's prediction shift")
    void perTypeThreshold() {
        monitoringConfig.setPredictionDriftThreshold(0.01);

        int exitCode = run((metrics, timeout) -> delivered.addAll(metrics));

        assertThat(exitCode).isEqualTo(MonitoringOutcome.EXIT_COMPLETED);
        assertThat(output()).contains("Prediction drift: true");
    }

    @Test
    @DisplayName("Command-line arguments override the configured model and environment")
    void argumentsOverrideTarget() {
        JobConfig resolved = MonitoringJob.resolve(config, new String[] {"fraud-v1", "staging"});
        JobConfig modelOnly = MonitoringJob.resolve(config, new String[] {"fraud-v1"});
        JobConfig none = MonitoringJob.resolve(config, new String[0]);

        assertThat(resolved.getModelId()).isEqualTo("fraud-v1");
        assertThat(resolved.getEnvironment()).isEqualTo("staging");
        assertThat(modelOnly.getEnvironment()).isEqualTo("prod");
        assertThat(none.getModelId()).isEqualTo("churn-v3");
        assertThat(config.getPublishTimeout()).isEqualTo(Duration.ofSeconds(10));
    }
}
