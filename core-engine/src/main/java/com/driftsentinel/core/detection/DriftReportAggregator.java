package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftResult;
import com.driftsentinel.core.model.DriftType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Combines the three drift results of a run into a {@link DriftReport}.
 *
 * <p>
 * All three results are required; there is no partial report.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftReportAggregator {

    private DriftReportAggregator() {
        // not instantiable
    }

    /**
     * @return a report keyed {@code data_drift}, {@code concept_drift},
     *         {@code prediction_drift}
     * @throws NullPointerException if any result is {@code null}
     */
    public static DriftReport aggregate(DriftResult dataDrift, DriftResult conceptDrift,
            DriftResult predictionDrift) {
        Map<DriftType, DriftResult> results = new EnumMap<>(DriftType.class);
        results.put(DriftType.DATA, Objects.requireNonNull(dataDrift, "data drift result must not be null"));
        results.put(DriftType.CONCEPT,
                Objects.requireNonNull(conceptDrift, "concept drift result must not be null"));
        results.put(DriftType.PREDICTION,
                Objects.requireNonNull(predictionDrift, "prediction drift result must not be null"));
        return new DriftReport(results);
    }
}
