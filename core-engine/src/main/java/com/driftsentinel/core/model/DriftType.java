package com.driftsentinel.core.model;

/**
 * The three kinds of drift a monitoring run evaluates.
 *
 * @since 1.0.0
 */
public enum DriftType {

    /** Shift in the distribution of input feature values. */
    DATA("data", "data_drift"),

    /** Loss of predictive accuracy against a recorded baseline. */
    CONCEPT("concept", "concept_drift"),

    /** Shift in the distribution of model outputs. */
    PREDICTION("prediction", "prediction_drift");

    private final String tag;
    private final String reportKey;

    DriftType(String tag, String reportKey) {
        this.tag = tag;
        this.reportKey = reportKey;
    }

    /**
     * @return short tag, e.g. {@code data}
     */
    public String tag() {
        return tag;
    }

    /**
     * @return key under which the result appears in reports and metric names,
     *         e.g. {@code data_drift}
     */
    public String reportKey() {
        return reportKey;
    }
}
