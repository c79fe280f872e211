package com.driftsentinel.job;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration for one monitoring job invocation.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a Kubernetes CronJob, Docker {@code -e} flags or
 * a shell. Detection settings (thresholds, namespace) live in the YAML file
 * referenced by {@code MONITORING_CONFIG_PATH}, not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /** Where metrics go. */
    public enum SinkType {
        LOG,
        KAFKA;

        static SinkType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unknown telemetry sink: '" + value + "'. Supported: log, kafka", e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Run target
    // ---------------------------------------------------------------
    private final String modelId;
    private final String environment;

    // ---------------------------------------------------------------
    // Sources
    // ---------------------------------------------------------------
    private final String monitoringConfigPath;
    private final String dataRoot;
    private final Duration dataSourceTimeout;

    // ---------------------------------------------------------------
    // Telemetry
    // ---------------------------------------------------------------
    private final SinkType telemetrySink;
    private final String kafkaBootstrapServers;
    private final String kafkaMetricsTopic;
    private final Duration publishTimeout;

    private JobConfig(Builder b) {
        this.modelId = b.modelId;
        this.environment = b.environment;
        this.monitoringConfigPath = b.monitoringConfigPath;
        this.dataRoot = b.dataRoot;
        this.dataSourceTimeout = b.dataSourceTimeout;
        this.telemetrySink = b.telemetrySink;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.publishTimeout = b.publishTimeout;
    }

    // ---------------------------------------------------------------
    // Resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .modelId(env("MODEL_ID", "demo-model"))
                    .environment(env("ENVIRONMENT", "dev"))
                    .monitoringConfigPath(env("MONITORING_CONFIG_PATH", ""))
                    .dataRoot(env("DATA_ROOT", "data"))
                    .dataSourceTimeout(Duration.ofMillis(parseLongEnv("DATA_SOURCE_TIMEOUT_MS", "30000")))
                    .telemetrySink(SinkType.parse(env("TELEMETRY_SINK", "log")))
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", "drift-metrics"))
                    .publishTimeout(Duration.ofMillis(parseLongEnv("PUBLISH_TIMEOUT_MS", "10000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Copy of this configuration targeting another model and environment.
     *
     * @param modelId     model identifier
     * @param environment deployment environment
     * @return validated copy
     */
    public JobConfig withTarget(String modelId, String environment) {
        return toBuilder().modelId(modelId).environment(environment).build();
    }

    // ---------------------------------------------------------------
    // Kafka properties helper
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties} for the metrics topic.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("client.id", "drift-sentinel-" + modelId);
        props.setProperty("delivery.timeout.ms", String.valueOf(Math.max(publishTimeout.toMillis(), 1_000L)));
        props.setProperty("request.timeout.ms", String.valueOf(Math.max(publishTimeout.toMillis(), 1_000L)));
        props.setProperty("linger.ms", "0");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getModelId() {
        return modelId;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getMonitoringConfigPath() {
        return monitoringConfigPath;
    }

    public String getDataRoot() {
        return dataRoot;
    }

    public Duration getDataSourceTimeout() {
        return dataSourceTimeout;
    }

    public SinkType getTelemetrySink() {
        return telemetrySink;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    private Builder toBuilder() {
        return new Builder()
                .modelId(modelId)
                .environment(environment)
                .monitoringConfigPath(monitoringConfigPath)
                .dataRoot(dataRoot)
                .dataSourceTimeout(dataSourceTimeout)
                .telemetrySink(telemetrySink)
                .kafkaBootstrapServers(kafkaBootstrapServers)
                .kafkaMetricsTopic(kafkaMetricsTopic)
                .publishTimeout(publishTimeout);
    }

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the run target and data root
     * are non-blank and that both timeouts are positive.
     * </p>
     */
    public static class Builder {
        private String modelId = "demo-model";
        private String environment = "dev";
        private String monitoringConfigPath = "";
        private String dataRoot = "data";
        private Duration dataSourceTimeout = Duration.ofSeconds(30);
        private SinkType telemetrySink = SinkType.LOG;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaMetricsTopic = "drift-metrics";
        private Duration publishTimeout = Duration.ofSeconds(10);

        public Builder modelId(String v) {
            this.modelId = v;
            return this;
        }

        public Builder environment(String v) {
            this.environment = v;
            return this;
        }

        public Builder monitoringConfigPath(String v) {
            this.monitoringConfigPath = v;
            return this;
        }

        public Builder dataRoot(String v) {
            this.dataRoot = v;
            return this;
        }

        public Builder dataSourceTimeout(Duration v) {
            this.dataSourceTimeout = v;
            return this;
        }

        public Builder telemetrySink(SinkType v) {
            this.telemetrySink = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder publishTimeout(Duration v) {
            this.publishTimeout = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(modelId, "modelId");
            requireNonBlank(environment, "environment");
            requireNonBlank(dataRoot, "dataRoot");
            Objects.requireNonNull(telemetrySink, "telemetrySink required");
            Objects.requireNonNull(monitoringConfigPath, "monitoringConfigPath required");
            requirePositive(dataSourceTimeout, "dataSourceTimeout");
            requirePositive(publishTimeout, "publishTimeout");

            if (telemetrySink == SinkType.KAFKA) {
                requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
                requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "modelId='" + modelId + '\'' +
                ", environment='" + environment + '\'' +
                ", monitoringConfigPath='" + monitoringConfigPath + '\'' +
                ", dataRoot='" + dataRoot + '\'' +
                ", dataSourceTimeout=" + dataSourceTimeout +
                ", telemetrySink=" + telemetrySink +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", publishTimeout=" + publishTimeout +
                '}';
    }
}
