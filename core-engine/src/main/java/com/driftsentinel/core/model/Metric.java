package com.driftsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single named measurement handed to the telemetry backend.
 *
 * <p>
 * Names follow {@code {modelId}/{metricKey}}, e.g.
 * {@code churn-v3/data_drift_score}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Metric {

    /** Unit attached to every drift metric. */
    public static final String UNIT_PERCENT = "Percent";

    private final String name;
    private final double value;
    private final String unit;
    private final Instant timestamp;

    public Metric(String name, double value, String unit, Instant timestamp) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metric that))
            return false;
        return Double.compare(value, that.value) == 0
                && name.equals(that.name)
                && unit.equals(that.unit)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, unit, timestamp);
    }

    @Override
    public String toString() {
        return "Metric{" +
                "name='" + name + '\'' +
                ", value=" + value +
                ", unit='" + unit + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
