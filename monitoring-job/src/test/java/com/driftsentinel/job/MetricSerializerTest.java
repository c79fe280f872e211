package com.driftsentinel.job;

import com.driftsentinel.core.model.Metric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricSerializer}.
 */
class MetricSerializerTest {

    private final MetricSerializer serializer = new MetricSerializer();

    @Test
    @DisplayName("Metric is written as JSON with an ISO-8601 timestamp")
    void json() {
        Metric metric = new Metric("fraud/prediction_drift_score", 12.5, Metric.UNIT_PERCENT,
                Instant.parse("2026-03-01T12:00:00Z"));

        String json = new String(serializer.serialize("drift-metrics", metric), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"name\":\"fraud/prediction_drift_score\"")
                .contains("\"value\":12.5")
                .contains("\"unit\":\"Percent\"")
                .contains("\"timestamp\":\"2026-03-01T12:00:00Z\"");
    }

    @Test
    @DisplayName("Null metric serializes to null")
    void nullMetric() {
        assertThat(serializer.serialize("drift-metrics", null)).isNull();
    }
}
