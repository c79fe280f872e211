package com.driftsentinel.job;

import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.Metric;
import com.driftsentinel.core.publish.TelemetrySink;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link TelemetrySink} that produces one Kafka record per metric.
 *
 * <p>
 * Record key is the metric name, the value is the metric as JSON (see
 * {@link MetricSerializer}) and the metric namespace travels in the
 * {@value #NAMESPACE_HEADER} header. {@link #emit} returns only after every
 * record has been acknowledged; anything short of that within the timeout is a
 * {@link PublishException}.
 * </p>
 */
public class KafkaTelemetrySink implements TelemetrySink, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaTelemetrySink.class);

    public static final String NAMESPACE_HEADER = "namespace";

    private final Producer<String, Metric> producer;
    private final String topic;
    private final byte[] namespace;

    public KafkaTelemetrySink(Producer<String, Metric> producer, String topic, String namespace) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null")
                .getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Build a sink with a real {@link KafkaProducer} for the configured
     * cluster and topic.
     */
    public static KafkaTelemetrySink create(JobConfig config, String namespace) {
        LOG.info("Publishing metrics to Kafka topic [{}] at {}",
                config.getKafkaMetricsTopic(), config.getKafkaBootstrapServers());
        Producer<String, Metric> producer = new KafkaProducer<>(
                config.kafkaProducerProperties(), new StringSerializer(), new MetricSerializer());
        return new KafkaTelemetrySink(producer, config.getKafkaMetricsTopic(), namespace);
    }

    @Override
    public void emit(List<Metric> metrics, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();

        List<Future<RecordMetadata>> pending = new ArrayList<>(metrics.size());
        for (Metric metric : metrics) {
            ProducerRecord<String, Metric> record = new ProducerRecord<>(topic, metric.getName(), metric);
            record.headers().add(NAMESPACE_HEADER, namespace);
            try {
                pending.add(producer.send(record));
            } catch (KafkaException | IllegalStateException e) {
                throw new PublishException("Failed to send metric " + metric.getName() + " to " + topic, e);
            }
        }

        for (int i = 0; i < pending.size(); i++) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                pending.get(i).get(remaining, TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                throw new PublishException("Kafka rejected metric " + metrics.get(i).getName()
                        + ": " + e.getCause().getMessage(), e.getCause());
            } catch (TimeoutException e) {
                throw new PublishException(String.format("%d of %d metric(s) not acknowledged by %s within %s",
                        pending.size() - i, pending.size(), topic, timeout), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PublishException("Interrupted while waiting for Kafka acknowledgements", e);
            }
        }
        LOG.debug("Kafka acknowledged {} metric(s) on {}", pending.size(), topic);
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(5));
    }
}
