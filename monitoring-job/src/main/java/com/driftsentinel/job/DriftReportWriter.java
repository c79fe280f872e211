package com.driftsentinel.job;

import com.driftsentinel.core.model.DriftReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Objects;

/**
 * Renders a {@link DriftReport} as JSON keyed by
 * {@code data_drift}, {@code concept_drift} and {@code prediction_drift}.
 */
public final class DriftReportWriter {

    private static final ObjectWriter PRETTY = JsonMappers.newObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter COMPACT = JsonMappers.newObjectMapper().writer();

    private DriftReportWriter() {
    }

    /**
     * @param report report to render; must not be {@code null}
     * @param pretty indent the output
     * @return JSON document
     * @throws IllegalStateException if the report cannot be serialized
     */
    public static String toJson(DriftReport report, boolean pretty) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return (pretty ? PRETTY : COMPACT).writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize drift report: " + e.getOriginalMessage(), e);
        }
    }
}
