package com.driftsentinel.job;

import com.driftsentinel.core.model.Metric;
import com.driftsentinel.core.publish.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Writes metrics to the application log. Development default.
 */
public class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    private final String namespace;

    public LoggingTelemetrySink(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
    }

    @Override
    public void emit(List<Metric> metrics, Duration timeout) {
        for (Metric metric : metrics) {
            LOG.info("[{}] {} = {} {} @ {}", namespace, metric.getName(), metric.getValue(),
                    metric.getUnit(), metric.getTimestamp());
        }
    }
}
