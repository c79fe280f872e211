package com.driftsentinel.job;

import com.driftsentinel.core.detection.DriftReportAggregator;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DriftReportWriter}.
 */
class DriftReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static DriftReport report() {
        DriftResult data = DriftResult.builder()
                .detected(true)
                .score(61.0)
                .detail("affected_features", List.of("income"))
                .detail("p_value", 0.003)
                .detail("feature_statistics", Map.of("income", 0.61))
                .build();
        DriftResult concept = DriftResult.builder()
                .detected(false)
                .score(2.0)
                .detail("current_accuracy", 0.9)
                .detail("baseline_accuracy", 0.92)
                .build();
        DriftResult prediction = DriftResult.builder()
                .detected(false)
                .score(4.0)
                .detail("current_mean", 0.52)
                .detail("baseline_mean", 0.5)
                .build();
        return DriftReportAggregator.aggregate(data, concept, prediction);
    }

    @Test
    @DisplayName("Report keys appear in drift type order")
    void topLevelKeys() throws Exception {
        JsonNode json = mapper.readTree(DriftReportWriter.toJson(report(), false));

        assertThat(json.fieldNames()).toIterable()
                .containsExactly("data_drift", "concept_drift", "prediction_drift");
    }

    @Test
    @DisplayName("Each result carries detected and score first, then its detail fields")
    void resultShape() throws Exception {
        JsonNode data = mapper.readTree(DriftReportWriter.toJson(report(), false)).get("data_drift");

        assertThat(data.fieldNames()).toIterable()
                .startsWith("detected", "score")
                .contains("affected_features", "p_value", "feature_statistics");
        assertThat(data.get("detected").asBoolean()).isTrue();
        assertThat(data.get("score").asDouble()).isEqualTo(61.0);
        assertThat(data.get("affected_features").get(0).asText()).isEqualTo("income");
        assertThat(data.get("feature_statistics").get("income").asDouble()).isEqualTo(0.61);
    }

    @Test
    @DisplayName("Pretty output is indented and parses to the same tree")
    void prettyPrinting() throws Exception {
        DriftReport report = report();
        String pretty = DriftReportWriter.toJson(report, true);

        assertThat(pretty).contains("\n  \"data_drift\" : {");
        assertThat(mapper.readTree(pretty)).isEqualTo(mapper.readTree(DriftReportWriter.toJson(report, false)));
    }
}
