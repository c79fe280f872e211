package com.driftsentinel.core.detection;

import com.driftsentinel.core.error.DegenerateBaselineException;
import com.driftsentinel.core.error.InsufficientDataException;
import com.driftsentinel.core.error.SchemaMismatchException;
import com.driftsentinel.core.model.Dataset;
import com.driftsentinel.core.model.DriftResult;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.stats.StatisticalTest;
import com.driftsentinel.core.stats.TestResult;
import com.driftsentinel.core.stats.TwoSampleKsTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Detects data, concept and prediction drift against a single threshold.
 *
 * <p>
 * This is a <strong>stateless</strong> detector: nothing is kept between
 * calls, so one instance can be shared by concurrent monitoring runs. Each
 * operation is a pure function of its arguments and the configured
 * {@link ThresholdConfig}.
 * </p>
 *
 * <h3>Detail fields</h3>
 * <ul>
 * <li>data drift: {@value #AFFECTED_FEATURES}, {@value #P_VALUE},
 * {@value #MAX_DRIFT_P_VALUE}, {@value #MAX_DRIFT_FEATURE},
 * {@value #FEATURE_STATISTICS}</li>
 * <li>concept drift: {@value #CURRENT_ACCURACY},
 * {@value #BASELINE_ACCURACY}</li>
 * <li>prediction drift: {@value #CURRENT_MEAN}, {@value #BASELINE_MEAN}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    public static final String AFFECTED_FEATURES = "affected_features";
    /** p-value of the last feature evaluated, in feature order. */
    public static final String P_VALUE = "p_value";
    /** p-value of the feature with the largest statistic. */
    public static final String MAX_DRIFT_P_VALUE = "max_drift_p_value";
    public static final String MAX_DRIFT_FEATURE = "max_drift_feature";
    public static final String FEATURE_STATISTICS = "feature_statistics";
    public static final String CURRENT_ACCURACY = "current_accuracy";
    public static final String BASELINE_ACCURACY = "baseline_accuracy";
    public static final String CURRENT_MEAN = "current_mean";
    public static final String BASELINE_MEAN = "baseline_mean";

    private final ThresholdConfig config;
    private final StatisticalTest statisticalTest;

    /**
     * @param config threshold configuration; must not be {@code null}
     */
    public DriftDetector(ThresholdConfig config) {
        this(config, new TwoSampleKsTest());
    }

    /**
     * @param config          threshold configuration; must not be {@code null}
     * @param statisticalTest per-feature test used for data drift; must not be
     *                        {@code null}
     */
    public DriftDetector(ThresholdConfig config, StatisticalTest statisticalTest) {
        this.config = Objects.requireNonNull(config, "ThresholdConfig must not be null");
        this.statisticalTest = Objects.requireNonNull(statisticalTest, "StatisticalTest must not be null");
    }

    public ThresholdConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Data drift
    // ---------------------------------------------------------------

    /**
     * Compare each feature column of {@code current} with the same column of
     * {@code baseline}.
     *
     * <p>
     * A feature is affected when its p-value is strictly below the threshold.
     * The score is {@code 100 * max(statistic)} over every feature, affected
     * or not.
     * </p>
     *
     * @param current  current dataset
     * @param baseline baseline dataset
     * @param features ordered feature names, one per column
     * @return data drift result
     * @throws SchemaMismatchException    if widths or feature count differ, or
     *                                    feature names repeat; a dataset with
     *                                    no rows and no width matches any
     *                                    feature count
     * @throws InsufficientDataException  if there are no features, either
     *                                    dataset has no rows, or a column has
     *                                    fewer than two values
     */
    public DriftResult detectDataDrift(Dataset current, Dataset baseline, List<String> features) {
        Objects.requireNonNull(current, "current dataset must not be null");
        Objects.requireNonNull(baseline, "baseline dataset must not be null");
        Objects.requireNonNull(features, "features must not be null");

        if (hasShape(current) && hasShape(baseline) && current.width() != baseline.width()) {
            throw new SchemaMismatchException(DriftType.DATA, String.format(
                    "current dataset has %d features, baseline has %d", current.width(), baseline.width()));
        }
        for (Dataset dataset : List.of(current, baseline)) {
            if (hasShape(dataset) && features.size() != dataset.width()) {
                throw new SchemaMismatchException(DriftType.DATA, String.format(
                        "%d feature names given for datasets of width %d", features.size(), dataset.width()));
            }
        }
        Set<String> seen = new HashSet<>();
        for (String feature : features) {
            if (!seen.add(Objects.requireNonNull(feature, "feature name must not be null"))) {
                throw new SchemaMismatchException(DriftType.DATA, "duplicate feature name '" + feature + "'");
            }
        }
        if (features.isEmpty()) {
            throw new InsufficientDataException(DriftType.DATA, "no features to compare");
        }
        if (current.rowCount() == 0 || baseline.rowCount() == 0) {
            throw new InsufficientDataException(DriftType.DATA, String.format(
                    "need rows on both sides, got current=%d baseline=%d",
                    current.rowCount(), baseline.rowCount()));
        }

        double threshold = config.threshold();
        List<String> affected = new ArrayList<>();
        Map<String, Double> statistics = new LinkedHashMap<>();
        String maxFeature = null;
        double maxStatistic = 0.0;
        double maxDriftPValue = 1.0;
        double lastPValue = 1.0;

        for (int i = 0; i < features.size(); i++) {
            String feature = features.get(i);
            TestResult result;
            try {
                result = statisticalTest.test(current.column(i), baseline.column(i));
            } catch (InsufficientDataException e) {
                throw new InsufficientDataException(DriftType.DATA,
                        "feature '" + feature + "': " + e.getMessage(), e);
            }

            statistics.put(feature, result.getStatistic());
            if (result.getPValue() < threshold) {
                affected.add(feature);
            }
            if (maxFeature == null || result.getStatistic() > maxStatistic) {
                maxFeature = feature;
                maxStatistic = result.getStatistic();
                maxDriftPValue = result.getPValue();
            }
            lastPValue = result.getPValue();

            LOG.debug("Feature [{}]: statistic={} pValue={} threshold={}",
                    feature, result.getStatistic(), result.getPValue(), threshold);
        }

        return DriftResult.builder()
                .detected(!affected.isEmpty())
                .score(maxStatistic * 100)
                .detail(AFFECTED_FEATURES, List.copyOf(affected))
                .detail(P_VALUE, lastPValue)
                .detail(MAX_DRIFT_P_VALUE, maxDriftPValue)
                .detail(MAX_DRIFT_FEATURE, maxFeature)
                .detail(FEATURE_STATISTICS, Collections.unmodifiableMap(statistics))
                .build();
    }

    // ---------------------------------------------------------------
    // Concept drift
    // ---------------------------------------------------------------

    /**
     * Compare the accuracy of {@code predictions} against {@code actuals} with
     * a previously recorded accuracy.
     *
     * @param predictions      predicted class labels
     * @param actuals          true class labels, aligned with
     *                         {@code predictions}
     * @param baselineAccuracy recorded accuracy in [0, 1]
     * @return concept drift result
     * @throws SchemaMismatchException   if the two sequences differ in length
     * @throws InsufficientDataException if the sequences are empty
     * @throws IllegalArgumentException  if {@code baselineAccuracy} is outside
     *                                   [0, 1]
     */
    public DriftResult detectConceptDrift(int[] predictions, int[] actuals, double baselineAccuracy) {
        Objects.requireNonNull(predictions, "predictions must not be null");
        Objects.requireNonNull(actuals, "actuals must not be null");
        if (Double.isNaN(baselineAccuracy) || baselineAccuracy < 0.0 || baselineAccuracy > 1.0) {
            throw new IllegalArgumentException("baselineAccuracy must be in [0, 1], got: " + baselineAccuracy);
        }
        if (predictions.length != actuals.length) {
            throw new SchemaMismatchException(DriftType.CONCEPT, String.format(
                    "%d predictions but %d actuals", predictions.length, actuals.length));
        }
        if (predictions.length == 0) {
            throw new InsufficientDataException(DriftType.CONCEPT, "no labelled predictions to score");
        }

        int matches = 0;
        for (int i = 0; i < predictions.length; i++) {
            if (predictions[i] == actuals[i]) {
                matches++;
            }
        }
        double accuracy = (double) matches / predictions.length;
        double degradation = Math.abs(baselineAccuracy - accuracy);

        LOG.debug("Concept drift: accuracy={} baseline={} degradation={}", accuracy, baselineAccuracy, degradation);

        return DriftResult.builder()
                .detected(degradation > config.threshold())
                .score(degradation * 100)
                .detail(CURRENT_ACCURACY, accuracy)
                .detail(BASELINE_ACCURACY, baselineAccuracy)
                .build();
    }

    // ---------------------------------------------------------------
    // Prediction drift
    // ---------------------------------------------------------------

    /**
     * Compare the mean of current model outputs with the baseline mean.
     *
     * @param currentPredictions  current outputs; lengths may differ from the
     *                            baseline
     * @param baselinePredictions baseline outputs
     * @return prediction drift result; the score may exceed 100
     * @throws InsufficientDataException   if either sequence is empty
     * @throws DegenerateBaselineException if the baseline mean is zero or not
     *                                     finite
     * @throws IllegalArgumentException    if the current mean is not finite
     */
    public DriftResult detectPredictionDrift(double[] currentPredictions, double[] baselinePredictions) {
        Objects.requireNonNull(currentPredictions, "currentPredictions must not be null");
        Objects.requireNonNull(baselinePredictions, "baselinePredictions must not be null");
        if (currentPredictions.length == 0 || baselinePredictions.length == 0) {
            throw new InsufficientDataException(DriftType.PREDICTION, String.format(
                    "need at least one prediction per side, got current=%d baseline=%d",
                    currentPredictions.length, baselinePredictions.length));
        }

        double currentMean = mean(currentPredictions);
        double baselineMean = mean(baselinePredictions);
        if (baselineMean == 0.0 || !Double.isFinite(baselineMean)) {
            throw new DegenerateBaselineException(DriftType.PREDICTION,
                    "baseline prediction mean is " + baselineMean + "; relative shift is undefined");
        }
        if (!Double.isFinite(currentMean)) {
            throw new IllegalArgumentException("current predictions contain non-finite values");
        }

        double ratio = Math.abs((currentMean - baselineMean) / baselineMean);
        if (!Double.isFinite(ratio)) {
            throw new DegenerateBaselineException(DriftType.PREDICTION,
                    "baseline prediction mean " + baselineMean + " is too close to zero");
        }

        LOG.debug("Prediction drift: currentMean={} baselineMean={} ratio={}", currentMean, baselineMean, ratio);

        return DriftResult.builder()
                .detected(ratio > config.threshold())
                .score(ratio * 100)
                .detail(CURRENT_MEAN, currentMean)
                .detail(BASELINE_MEAN, baselineMean)
                .build();
    }

    /** A dataset built from an empty matrix carries no width. */
    private static boolean hasShape(Dataset dataset) {
        return dataset.rowCount() > 0 || dataset.width() > 0;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    @Override
    public String toString() {
        return "DriftDetector{" + config + '}';
    }
}
