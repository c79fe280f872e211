package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitoringSnapshot}.
 */
class MonitoringSnapshotTest {

    private static final Dataset TWO_COLUMNS = Dataset.of(new double[][] { { 1, 10 }, { 2, 20 } });

    private static MonitoringSnapshot snapshot(Dataset current, double baselineAccuracy, double[] currentPredictions) {
        return new MonitoringSnapshot(List.of("age", "income"), current, TWO_COLUMNS,
                new int[] { 1, 0 }, new int[] { 1, 1 }, baselineAccuracy,
                currentPredictions, new double[] { 0.5, 0.5 });
    }

    @Test
    @DisplayName("Empty data matrix takes its width from the feature list")
    void emptyMatrixTakesFeatureWidth() {
        MonitoringSnapshot snapshot = snapshot(Dataset.of(new double[0][]), 0.9, new double[] { 0.4 });

        assertThat(snapshot.getCurrent().rowCount()).isZero();
        assertThat(snapshot.getCurrent().width()).isEqualTo(2);
        assertThat(snapshot.getBaseline()).isEqualTo(TWO_COLUMNS);
    }

    @Test
    @DisplayName("Baseline accuracy outside [0, 1] is rejected")
    void baselineAccuracyRange() {
        assertThatThrownBy(() -> snapshot(TWO_COLUMNS, 1.5, new double[] { 0.4 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseline_accuracy");
        assertThatThrownBy(() -> snapshot(TWO_COLUMNS, Double.NaN, new double[] { 0.4 }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(snapshot(TWO_COLUMNS, 0.0, new double[] { 0.4 }).getBaselineAccuracy()).isZero();
        assertThat(snapshot(TWO_COLUMNS, 1.0, new double[] { 0.4 }).getBaselineAccuracy()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Non-finite current predictions are rejected with their position")
    void currentPredictionsFinite() {
        assertThatThrownBy(() -> snapshot(TWO_COLUMNS, 0.9, new double[] { 0.4, Double.NaN }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("current_predictions[1]");
        assertThatThrownBy(() -> snapshot(TWO_COLUMNS, 0.9, new double[] { Double.NEGATIVE_INFINITY }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
