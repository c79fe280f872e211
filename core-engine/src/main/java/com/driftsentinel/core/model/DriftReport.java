package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The three drift results of one monitoring run.
 *
 * <p>
 * Always complete: a report holds exactly one result per {@link DriftType}.
 * Instances are created by
 * {@link com.driftsentinel.core.detection.DriftReportAggregator} and never
 * change afterwards. Serializes as
 * {@code {"data_drift": {...}, "concept_drift": {...}, "prediction_drift": {...}}}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftReport {

    private final Map<DriftType, DriftResult> results;

    /**
     * @param results one result per drift type
     * @throws IllegalArgumentException if a drift type is missing
     */
    public DriftReport(Map<DriftType, DriftResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        EnumMap<DriftType, DriftResult> copy = new EnumMap<>(DriftType.class);
        for (DriftType type : DriftType.values()) {
            DriftResult result = results.get(type);
            if (result == null) {
                throw new IllegalArgumentException("Drift report is missing the " + type.reportKey() + " result");
            }
            copy.put(type, result);
        }
        this.results = Collections.unmodifiableMap(copy);
    }

    /**
     * @param type drift type
     * @return the result for {@code type}; never {@code null}
     */
    public DriftResult get(DriftType type) {
        return results.get(Objects.requireNonNull(type, "type must not be null"));
    }

    public DriftResult getDataDrift() {
        return results.get(DriftType.DATA);
    }

    public DriftResult getConceptDrift() {
        return results.get(DriftType.CONCEPT);
    }

    public DriftResult getPredictionDrift() {
        return results.get(DriftType.PREDICTION);
    }

    /**
     * @return unmodifiable view keyed by drift type, in declaration order
     */
    public Map<DriftType, DriftResult> getResults() {
        return results;
    }

    /**
     * @return {@code true} if any of the three detectors fired
     */
    public boolean anyDetected() {
        return results.values().stream().anyMatch(DriftResult::isDetected);
    }

    /**
     * @return results keyed by report key ({@code data_drift}, ...), in
     *         declaration order
     */
    @JsonValue
    public Map<String, DriftResult> asMap() {
        Map<String, DriftResult> byKey = new LinkedHashMap<>();
        results.forEach((type, result) -> byKey.put(type.reportKey(), result));
        return Collections.unmodifiableMap(byKey);
    }

    /**
     * @return one-line summary of which detectors fired
     */
    public String summary() {
        return "Data drift: " + getDataDrift().isDetected()
                + ", Concept drift: " + getConceptDrift().isDetected()
                + ", Prediction drift: " + getPredictionDrift().isDetected();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftReport that))
            return false;
        return results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return results.hashCode();
    }

    @Override
    public String toString() {
        return "DriftReport" + asMap();
    }
}
