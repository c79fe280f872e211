package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Everything a data source supplies for one monitoring run.
 *
 * <p>
 * Shapes are not checked here. The detector validates them, so a malformed
 * snapshot fails during detection with a typed error naming the drift type.
 * Values the detector would reject as programming errors are checked on
 * construction instead: {@code baseline_accuracy} must lie in [0, 1] and
 * {@code current_predictions} must be finite. An empty data matrix takes its
 * width from {@code features}.
 * </p>
 *
 * <h3>JSON layout</h3>
 *
 * <pre>
 * {
 *   "features": ["age", "income"],
 *   "current_data": [[34.0, 51000.0], ...],
 *   "baseline_data": [[29.0, 48000.0], ...],
 *   "predictions": [1, 0, ...],
 *   "actuals": [1, 1, ...],
 *   "baseline_accuracy": 0.95,
 *   "current_predictions": [0.71, ...],
 *   "baseline_predictions": [0.68, ...]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public final class MonitoringSnapshot {

    private final List<String> features;
    private final Dataset current;
    private final Dataset baseline;
    private final int[] predictions;
    private final int[] actuals;
    private final double baselineAccuracy;
    private final double[] currentPredictions;
    private final double[] baselinePredictions;

    @JsonCreator
    public MonitoringSnapshot(
            @JsonProperty("features") List<String> features,
            @JsonProperty("current_data") Dataset current,
            @JsonProperty("baseline_data") Dataset baseline,
            @JsonProperty("predictions") int[] predictions,
            @JsonProperty("actuals") int[] actuals,
            @JsonProperty("baseline_accuracy") Double baselineAccuracy,
            @JsonProperty("current_predictions") double[] currentPredictions,
            @JsonProperty("baseline_predictions") double[] baselinePredictions) {
        this.features = List.copyOf(Objects.requireNonNull(features, "features must not be null"));
        this.current = shaped(Objects.requireNonNull(current, "current_data must not be null"), this.features);
        this.baseline = shaped(Objects.requireNonNull(baseline, "baseline_data must not be null"), this.features);
        this.predictions = Objects.requireNonNull(predictions, "predictions must not be null").clone();
        this.actuals = Objects.requireNonNull(actuals, "actuals must not be null").clone();
        this.baselineAccuracy = Objects.requireNonNull(baselineAccuracy, "baseline_accuracy must not be null");
        if (Double.isNaN(this.baselineAccuracy) || this.baselineAccuracy < 0.0 || this.baselineAccuracy > 1.0) {
            throw new IllegalArgumentException("baseline_accuracy must be in [0, 1], got: " + this.baselineAccuracy);
        }
        this.currentPredictions = Objects.requireNonNull(currentPredictions,
                "current_predictions must not be null").clone();
        this.baselinePredictions = Objects.requireNonNull(baselinePredictions,
                "baseline_predictions must not be null").clone();
        for (int i = 0; i < this.currentPredictions.length; i++) {
            if (!Double.isFinite(this.currentPredictions[i])) {
                throw new IllegalArgumentException(
                        "current_predictions[" + i + "] is not finite: " + this.currentPredictions[i]);
            }
        }
    }

    private static Dataset shaped(Dataset dataset, List<String> features) {
        return dataset.rowCount() == 0 && dataset.width() == 0 ? Dataset.empty(features.size()) : dataset;
    }

    @JsonProperty("features")
    public List<String> getFeatures() {
        return features;
    }

    @JsonProperty("current_data")
    public Dataset getCurrent() {
        return current;
    }

    @JsonProperty("baseline_data")
    public Dataset getBaseline() {
        return baseline;
    }

    @JsonProperty("predictions")
    public int[] getPredictions() {
        return predictions.clone();
    }

    @JsonProperty("actuals")
    public int[] getActuals() {
        return actuals.clone();
    }

    @JsonProperty("baseline_accuracy")
    public double getBaselineAccuracy() {
        return baselineAccuracy;
    }

    @JsonProperty("current_predictions")
    public double[] getCurrentPredictions() {
        return currentPredictions.clone();
    }

    @JsonProperty("baseline_predictions")
    public double[] getBaselinePredictions() {
        return baselinePredictions.clone();
    }

    @Override
    public String toString() {
        return "MonitoringSnapshot{" +
                "features=" + features +
                ", current=" + current +
                ", baseline=" + baseline +
                ", labels=" + predictions.length +
                ", baselineAccuracy=" + baselineAccuracy +
                ", currentPredictions=" + currentPredictions.length +
                ", baselinePredictions=" + baselinePredictions.length +
                '}';
    }
}
