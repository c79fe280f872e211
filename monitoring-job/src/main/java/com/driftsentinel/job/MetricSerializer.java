package com.driftsentinel.job;

import com.driftsentinel.core.model.Metric;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} that converts {@link Metric} → JSON bytes for the
 * metrics topic.
 *
 * <pre>
 * {"name":"fraud-v3/data_drift_score","value":42.5,"unit":"Percent","timestamp":"2024-05-01T00:00:00Z"}
 * </pre>
 */
public class MetricSerializer implements Serializer<Metric> {

    private ObjectMapper mapper;

    @Override
    public byte[] serialize(String topic, Metric metric) {
        if (metric == null) {
            return null;
        }
        try {
            return objectMapper().writeValueAsBytes(metric);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize metric " + metric.getName(), e);
        }
    }

    private synchronized ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = JsonMappers.newObjectMapper();
        }
        return mapper;
    }
}
