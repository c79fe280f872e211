package com.driftsentinel.core.publish;

import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns drift reports into named metrics and hands them to a
 * {@link TelemetrySink}.
 *
 * <h3>Naming</h3>
 * <p>
 * Each scalar numeric field of a result becomes one metric named
 * {@code {modelId}/{reportKey}_{field}}, e.g.
 * {@code fraud-v2/data_drift_score} or
 * {@code fraud-v2/concept_drift_current_accuracy}. Booleans, strings, lists
 * and maps are not published.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Sink failures surface as {@link PublishException}. The publisher does not
 * retry; callers hold on to the report and may publish it again.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsPublisher.class);

    private final TelemetrySink sink;
    private final Clock clock;
    private final Duration timeout;

    /**
     * @param sink    metric destination; must not be {@code null}
     * @param clock   source of metric timestamps; must not be {@code null}
     * @param timeout bound passed to every {@link TelemetrySink#emit} call;
     *                must be positive
     */
    public MetricsPublisher(TelemetrySink sink, Clock clock, Duration timeout) {
        this.sink = Objects.requireNonNull(sink, "TelemetrySink must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    /**
     * Flatten a report into {@code {reportKey}_{field}} entries, keeping only
     * scalar numbers.
     *
     * @param report the report; must not be {@code null}
     * @return insertion-ordered metric keys and values
     * @throws IllegalStateException if two fields flatten to the same name
     */
    public static Map<String, Double> flatten(DriftReport report) {
        Objects.requireNonNull(report, "DriftReport must not be null");
        Map<String, Double> values = new LinkedHashMap<>();
        report.getResults().forEach((type, result) -> {
            String prefix = type.reportKey() + "_";
            putUnique(values, prefix + "score", result.getScore());
            result.getDetail().forEach((field, value) -> {
                if (value instanceof Number n) {
                    putUnique(values, prefix + field, n.doubleValue());
                }
            });
        });
        return values;
    }

    private static void putUnique(Map<String, Double> values, String key, double value) {
        if (values.putIfAbsent(key, value) != null) {
            throw new IllegalStateException("Duplicate metric name: " + key);
        }
    }

    /**
     * Publish every numeric field of {@code report}.
     *
     * @param report  the report; must not be {@code null}
     * @param modelId model identifier used as metric name prefix
     * @return the metrics that were delivered
     * @throws PublishException if the sink fails
     */
    public List<Metric> publish(DriftReport report, String modelId) {
        return publish(flatten(report), modelId);
    }

    /**
     * Publish every numeric entry of a flat mapping.
     *
     * @param values  metric keys to values; non-numeric values are skipped
     * @param modelId model identifier used as metric name prefix; must not be
     *                blank
     * @return the metrics that were delivered
     * @throws PublishException if the sink fails
     */
    public List<Metric> publish(Map<String, ?> values, String modelId) {
        Objects.requireNonNull(values, "values must not be null");
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be null or blank");
        }

        List<Metric> metrics = toMetrics(values, modelId, clock.instant());
        if (metrics.isEmpty()) {
            LOG.warn("No numeric metrics to publish for model {}", modelId);
            return metrics;
        }

        try {
            sink.emit(metrics, timeout);
        } catch (PublishException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PublishException("Telemetry sink failed for model " + modelId + ": " + e.getMessage(), e);
        }

        LOG.info("Published {} metric(s) for model {}", metrics.size(), modelId);
        return metrics;
    }

    private static List<Metric> toMetrics(Map<String, ?> values, String modelId, Instant timestamp) {
        List<Metric> metrics = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                continue;
            }
            double value = number.doubleValue();
            if (!Double.isFinite(value)) {
                LOG.warn("Skipping metric '{}' for model {}: value {} is not finite", entry.getKey(), modelId, value);
                continue;
            }
            metrics.add(new Metric(modelId + "/" + entry.getKey(), value, Metric.UNIT_PERCENT, timestamp));
        }
        return Collections.unmodifiableList(metrics);
    }
}
