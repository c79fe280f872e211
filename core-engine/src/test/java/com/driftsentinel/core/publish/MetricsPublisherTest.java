package com.driftsentinel.core.publish;

import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.DriftReportAggregator;
import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftResult;
import com.driftsentinel.core.model.Metric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricsPublisher}.
 */
class MetricsPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(3);

    private RecordingSink sink;
    private MetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        publisher = new MetricsPublisher(sink, Clock.fixed(NOW, ZoneOffset.UTC), TIMEOUT);
    }

    @Test
    @DisplayName("Should emit one metric per numeric report field, namespaced by model")
    void shouldEmitNumericFields() {
        List<Metric> metrics = publisher.publish(sampleReport(), "churn-v3");

        assertThat(metrics).extracting(Metric::getName).containsExactly(
                "churn-v3/data_drift_score",
                "churn-v3/data_drift_p_value",
                "churn-v3/data_drift_max_drift_p_value",
                "churn-v3/concept_drift_score",
                "churn-v3/concept_drift_current_accuracy",
                "churn-v3/concept_drift_baseline_accuracy",
                "churn-v3/prediction_drift_score",
                "churn-v3/prediction_drift_current_mean",
                "churn-v3/prediction_drift_baseline_mean");
        assertThat(metrics).allSatisfy(m -> {
            assertThat(m.getUnit()).isEqualTo("Percent");
            assertThat(m.getTimestamp()).isEqualTo(NOW);
        });
        assertThat(metrics.get(0).getValue()).isEqualTo(37.5);
    }

    @Test
    @DisplayName("Should send all metrics of a call as one batch with the configured timeout")
    void shouldEmitSingleBatch() {
        List<Metric> metrics = publisher.publish(sampleReport(), "churn-v3");

        assertThat(sink.batches).hasSize(1);
        assertThat(sink.batches.get(0)).isEqualTo(metrics);
        assertThat(sink.timeouts).containsExactly(TIMEOUT);
    }

    @Test
    @DisplayName("Should skip booleans, strings, collections and non-finite numbers")
    void shouldSkipNonScalarValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("score", 12);
        values.put("detected", true);
        values.put("feature", "age");
        values.put("affected_features", List.of("age"));
        values.put("p_value", Double.NaN);

        List<Metric> metrics = publisher.publish(values, "m1");

        assertThat(metrics).extracting(Metric::getName).containsExactly("m1/score");
        assertThat(metrics.get(0).getValue()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should not call the sink when nothing is numeric")
    void shouldNotEmitEmptyBatch() {
        List<Metric> metrics = publisher.publish(Map.of("feature", "age"), "m1");

        assertThat(metrics).isEmpty();
        assertThat(sink.batches).isEmpty();
    }

    @Test
    @DisplayName("Should propagate PublishException from the sink unchanged")
    void shouldPropagatePublishException() {
        PublishException failure = new PublishException("backend down");
        MetricsPublisher failing = new MetricsPublisher((metrics, timeout) -> {
            throw failure;
        }, Clock.systemUTC(), TIMEOUT);

        assertThatThrownBy(() -> failing.publish(sampleReport(), "m1")).isSameAs(failure);
    }

    @Test
    @DisplayName("Should wrap other sink failures in PublishException")
    void shouldWrapSinkFailures() {
        MetricsPublisher failing = new MetricsPublisher((metrics, timeout) -> {
            throw new IllegalStateException("connection reset");
        }, Clock.systemUTC(), TIMEOUT);

        assertThatThrownBy(() -> failing.publish(sampleReport(), "m1"))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should require a model id and a positive timeout")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> publisher.publish(sampleReport(), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricsPublisher(sink, Clock.systemUTC(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DriftReport sampleReport() {
        DriftResult data = DriftResult.builder()
                .detected(true)
                .score(37.5)
                .detail(DriftDetector.AFFECTED_FEATURES, List.of("age"))
                .detail(DriftDetector.P_VALUE, 0.4)
                .detail(DriftDetector.MAX_DRIFT_P_VALUE, 0.01)
                .detail(DriftDetector.MAX_DRIFT_FEATURE, "age")
                .detail(DriftDetector.FEATURE_STATISTICS, Map.of("age", 0.375))
                .build();
        DriftResult concept = DriftResult.builder()
                .score(2.0)
                .detail(DriftDetector.CURRENT_ACCURACY, 0.93)
                .detail(DriftDetector.BASELINE_ACCURACY, 0.95)
                .build();
        DriftResult prediction = DriftResult.builder()
                .score(4.0)
                .detail(DriftDetector.CURRENT_MEAN, 0.52)
                .detail(DriftDetector.BASELINE_MEAN, 0.5)
                .build();
        return DriftReportAggregator.aggregate(data, concept, prediction);
    }

    private static final class RecordingSink implements TelemetrySink {
        final List<List<Metric>> batches = new ArrayList<>();
        final List<Duration> timeouts = new ArrayList<>();

        @Override
        public void emit(List<Metric> metrics, Duration timeout) {
            batches.add(List.copyOf(metrics));
            timeouts.add(timeout);
        }
    }
}
