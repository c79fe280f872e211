package com.driftsentinel.core.config;

import com.driftsentinel.core.detection.DetectorSuite;
import com.driftsentinel.core.detection.DriftDetector;
import com.driftsentinel.core.detection.ThresholdConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Detection settings loaded from YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * threshold: 0.10
 * dataDriftThreshold: 0.05        # optional, falls back to threshold
 * conceptDriftThreshold: 0.10     # optional
 * predictionDriftThreshold: 0.20  # optional
 * metricNamespace: MLOps/Monitoring
 * parallelDetection: false
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringConfig {

    public static final String DEFAULT_NAMESPACE = "MLOps/Monitoring";

    private double threshold = ThresholdConfig.DEFAULT_THRESHOLD;
    private Double dataDriftThreshold;
    private Double conceptDriftThreshold;
    private Double predictionDriftThreshold;
    private String metricNamespace = DEFAULT_NAMESPACE;
    private boolean parallelDetection;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every threshold and the namespace, collecting all problems.
     *
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkThreshold("threshold", threshold, errors);
        checkThreshold("dataDriftThreshold", dataDriftThreshold, errors);
        checkThreshold("conceptDriftThreshold", conceptDriftThreshold, errors);
        checkThreshold("predictionDriftThreshold", predictionDriftThreshold, errors);
        if (metricNamespace == null || metricNamespace.isBlank()) {
            errors.add("'metricNamespace' must not be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitoring configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void checkThreshold(String name, Double value, List<String> errors) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            errors.add("'" + name + "' must be in [0, 1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Detector wiring
    // ---------------------------------------------------------------

    /**
     * Build the detectors described by this configuration. Without per-type
     * overrides a single detector is shared by all three drift types.
     *
     * @return detector per drift type
     */
    public DetectorSuite toDetectorSuite() {
        DriftDetector shared = new DriftDetector(ThresholdConfig.of(threshold));
        if (dataDriftThreshold == null && conceptDriftThreshold == null && predictionDriftThreshold == null) {
            return DetectorSuite.uniform(shared);
        }
        return DetectorSuite.of(
                detectorFor(dataDriftThreshold, shared),
                detectorFor(conceptDriftThreshold, shared),
                detectorFor(predictionDriftThreshold, shared));
    }

    private static DriftDetector detectorFor(Double override, DriftDetector shared) {
        return override != null ? new DriftDetector(ThresholdConfig.of(override)) : shared;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Double getDataDriftThreshold() {
        return dataDriftThreshold;
    }

    public void setDataDriftThreshold(Double dataDriftThreshold) {
        this.dataDriftThreshold = dataDriftThreshold;
    }

    public Double getConceptDriftThreshold() {
        return conceptDriftThreshold;
    }

    public void setConceptDriftThreshold(Double conceptDriftThreshold) {
        this.conceptDriftThreshold = conceptDriftThreshold;
    }

    public Double getPredictionDriftThreshold() {
        return predictionDriftThreshold;
    }

    public void setPredictionDriftThreshold(Double predictionDriftThreshold) {
        this.predictionDriftThreshold = predictionDriftThreshold;
    }

    public String getMetricNamespace() {
        return metricNamespace;
    }

    public void setMetricNamespace(String metricNamespace) {
        this.metricNamespace = metricNamespace;
    }

    public boolean isParallelDetection() {
        return parallelDetection;
    }

    public void setParallelDetection(boolean parallelDetection) {
        this.parallelDetection = parallelDetection;
    }

    @Override
    public String toString() {
        return "MonitoringConfig{" +
                "threshold=" + threshold +
                ", dataDriftThreshold=" + dataDriftThreshold +
                ", conceptDriftThreshold=" + conceptDriftThreshold +
                ", predictionDriftThreshold=" + predictionDriftThreshold +
                ", metricNamespace='" + metricNamespace + '\'' +
                ", parallelDetection=" + parallelDetection +
                '}';
    }
}
