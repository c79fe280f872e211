package com.driftsentinel.core.detection;

/**
 * Significance threshold shared by every detection operation of one
 * {@link DriftDetector}.
 *
 * <p>
 * Data drift compares per-feature p-values against it (strictly below
 * fires); concept and prediction drift compare their shift ratio against it
 * (strictly above fires). It must be finite and within [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdConfig {

    /** Threshold used when none is configured. */
    public static final double DEFAULT_THRESHOLD = 0.10;

    private final double threshold;

    private ThresholdConfig(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @param threshold value in [0, 1]
     * @return the configuration
     * @throws IllegalArgumentException if {@code threshold} is NaN or outside
     *                                  [0, 1]
     */
    public static ThresholdConfig of(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        return new ThresholdConfig(threshold);
    }

    public static ThresholdConfig defaults() {
        return new ThresholdConfig(DEFAULT_THRESHOLD);
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdConfig that))
            return false;
        return Double.compare(threshold, that.threshold) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(threshold);
    }

    @Override
    public String toString() {
        return "ThresholdConfig{threshold=" + threshold + '}';
    }
}
