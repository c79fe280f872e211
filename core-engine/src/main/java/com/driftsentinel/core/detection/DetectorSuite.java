package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.DriftType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One {@link DriftDetector} per drift type.
 *
 * <p>
 * A detector carries a single threshold. When drift types need different
 * thresholds the suite holds three independently configured detectors;
 * otherwise all three entries point at the same instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorSuite {

    private final Map<DriftType, DriftDetector> detectors;

    private DetectorSuite(DriftDetector data, DriftDetector concept, DriftDetector prediction) {
        Map<DriftType, DriftDetector> map = new EnumMap<>(DriftType.class);
        map.put(DriftType.DATA, Objects.requireNonNull(data, "data drift detector must not be null"));
        map.put(DriftType.CONCEPT, Objects.requireNonNull(concept, "concept drift detector must not be null"));
        map.put(DriftType.PREDICTION,
                Objects.requireNonNull(prediction, "prediction drift detector must not be null"));
        this.detectors = map;
    }

    /**
     * @param detector detector used for every drift type
     * @return suite sharing one detector
     */
    public static DetectorSuite uniform(DriftDetector detector) {
        return new DetectorSuite(detector, detector, detector);
    }

    public static DetectorSuite of(DriftDetector data, DriftDetector concept, DriftDetector prediction) {
        return new DetectorSuite(data, concept, prediction);
    }

    /**
     * @param type drift type
     * @return the detector responsible for {@code type}
     */
    public DriftDetector forType(DriftType type) {
        return detectors.get(Objects.requireNonNull(type, "type must not be null"));
    }

    @Override
    public String toString() {
        return "DetectorSuite" + detectors;
    }
}
