package com.driftsentinel.job;

import com.driftsentinel.core.config.MonitoringConfig;
import com.driftsentinel.core.config.MonitoringConfigLoader;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.monitor.MonitoringOrchestrator;
import com.driftsentinel.core.monitor.MonitoringOutcome;
import com.driftsentinel.core.publish.MetricsPublisher;
import com.driftsentinel.core.publish.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for a single drift monitoring run.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   snapshot.json (DATA_ROOT)
 *     → FileSnapshotDataSource
 *     → MonitoringOrchestrator (data / concept / prediction drift)
 *     → MetricsPublisher → log or Kafka metrics topic
 *     → report JSON on stdout, exit code from the outcome
 * </pre>
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   java -jar monitoring-job.jar [modelId] [environment]
 * </pre>
 * <p>
 * Arguments fall back to {@code MODEL_ID} and {@code ENVIRONMENT}; everything
 * else is resolved by {@link JobConfig#fromEnvironment()}.
 * </p>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0}: run completed, metrics delivered</li>
 * <li>{@code 1}: run failed (data source, detection, configuration)</li>
 * <li>{@code 2}: drift computed but metrics not delivered</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class MonitoringJob {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringJob.class);

    private MonitoringJob() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Resolve configuration, build the sink and execute one run.
     *
     * @return process exit code
     */
    static int run(String[] args, PrintStream out) {
        TelemetrySink sink = null;
        try {
            JobConfig config = resolve(JobConfig.fromEnvironment(), args);
            LOG.info("Starting drift monitoring with config: {}", config);

            MonitoringConfig monitoringConfig = loadMonitoringConfig(config);
            LOG.info("Loaded monitoring config: {}", monitoringConfig);

            sink = createSink(config, monitoringConfig.getMetricNamespace());
            return run(config, monitoringConfig, sink, out);
        } catch (RuntimeException e) {
            LOG.error("Drift monitoring could not run: {}", e.getMessage(), e);
            return MonitoringOutcome.EXIT_RUN_FAILED;
        } finally {
            if (sink instanceof KafkaTelemetrySink kafkaSink) {
                kafkaSink.close();
            }
        }
    }

    /**
     * Execute one run with explicit collaborators.
     *
     * <p>
     * Prints the drift report (when one was computed) as pretty JSON to
     * {@code out}.
     * </p>
     *
     * @return process exit code
     */
    static int run(JobConfig config, MonitoringConfig monitoringConfig, TelemetrySink sink, PrintStream out) {
        ExecutorService executor = monitoringConfig.isParallelDetection() ? newDetectionExecutor() : null;
        try {
            MonitoringOrchestrator orchestrator = new MonitoringOrchestrator(
                    new FileSnapshotDataSource(Path.of(config.getDataRoot())),
                    monitoringConfig.toDetectorSuite(),
                    new MetricsPublisher(sink, Clock.systemUTC(), config.getPublishTimeout()),
                    config.getDataSourceTimeout(),
                    executor);

            MonitoringOutcome outcome = orchestrator.run(config.getModelId(), config.getEnvironment());
            outcome.getReport().ifPresent(report -> out.println(DriftReportWriter.toJson(report, true)));
            out.println(outcome.summary());
            return outcome.exitCode();
        } catch (RuntimeException e) {
            LOG.error("Drift monitoring aborted for [{}] in [{}]: {}",
                    config.getModelId(), config.getEnvironment(), e.getMessage(), e);
            return MonitoringOutcome.EXIT_RUN_FAILED;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static JobConfig resolve(JobConfig config, String[] args) {
        String modelId = args.length > 0 ? args[0] : config.getModelId();
        String environment = args.length > 1 ? args[1] : config.getEnvironment();
        return config.withTarget(modelId, environment);
    }

    private static MonitoringConfig loadMonitoringConfig(JobConfig config) {
        String path = config.getMonitoringConfigPath();
        if (path != null && !path.isBlank()) {
            return MonitoringConfigLoader.fromFile(path);
        }
        return MonitoringConfigLoader.load();
    }

    private static TelemetrySink createSink(JobConfig config, String namespace) {
        switch (config.getTelemetrySink()) {
            case KAFKA:
                return KafkaTelemetrySink.create(config, namespace);
            case LOG:
            default:
                return new LoggingTelemetrySink(namespace);
        }
    }

    private static ExecutorService newDetectionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(DriftType.values().length, r -> {
            Thread t = new Thread(r, "drift-detection-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
