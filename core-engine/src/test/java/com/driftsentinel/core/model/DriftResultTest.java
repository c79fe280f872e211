package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriftResult}.
 */
class DriftResultTest {

    @Test
    @DisplayName("Nested maps and lists are copied and read-only after build")
    @SuppressWarnings("unchecked")
    void nestedDetailsAreFrozen() {
        Map<String, Double> statistics = new LinkedHashMap<>();
        statistics.put("age", 0.12);
        List<String> affected = new ArrayList<>(List.of("age"));

        DriftResult result = DriftResult.builder()
                .detected(true)
                .score(12.0)
                .detail("feature_statistics", statistics)
                .detail("affected_features", affected)
                .build();
        statistics.put("age", 0.99);
        affected.add("income");

        Map<String, Double> stored = (Map<String, Double>) result.getDetail().get("feature_statistics");
        assertThat(stored).containsExactly(Map.entry("age", 0.12));
        assertThat(result.getDetail().get("affected_features")).isEqualTo(List.of("age"));
        assertThatThrownBy(() -> stored.put("age", 0.99))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getDetail().put("p_value", 0.5))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("detected and score cannot be used as detail keys")
    void reservedKeysAreRejected() {
        assertThatThrownBy(() -> DriftResult.builder().detail("score", 50.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'score' is reserved");
        assertThatThrownBy(() -> DriftResult.builder().detail("detected", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'detected' is reserved");
    }

    @Test
    @DisplayName("Score must be finite")
    void scoreMustBeFinite() {
        assertThatThrownBy(() -> DriftResult.builder().score(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DriftResult.builder().score(Double.POSITIVE_INFINITY).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
