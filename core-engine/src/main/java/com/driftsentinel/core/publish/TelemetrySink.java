package com.driftsentinel.core.publish;

import com.driftsentinel.core.error.PublishException;
import com.driftsentinel.core.model.Metric;

import java.time.Duration;
import java.util.List;

/**
 * Destination for drift metrics (a metrics service, a Kafka topic, a log).
 *
 * @since 1.0.0
 */
public interface TelemetrySink {

    /**
     * Deliver a batch of metrics.
     *
     * @param metrics metrics to deliver; never empty
     * @param timeout upper bound on how long delivery may block
     * @throws PublishException if the backend is unreachable, rejects the batch
     *                          or does not acknowledge it in time
     */
    void emit(List<Metric> metrics, Duration timeout);
}
