package com.driftsentinel.core.error;

import com.driftsentinel.core.model.DriftType;

import java.util.Optional;

/**
 * Failure raised while computing a drift result.
 *
 * <p>
 * Carries the {@link DriftType} of the detection operation that failed when
 * it is known. Low-level statistics code throws without one; the detector
 * re-throws with the operation attached.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class DetectionException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final DriftType driftType;

    protected DetectionException(DriftType driftType, String message, Throwable cause) {
        super(driftType != null ? "[" + driftType.reportKey() + "] " + message : message, cause);
        this.driftType = driftType;
    }

    /**
     * @return the detection operation that failed, if known
     */
    public Optional<DriftType> getDriftType() {
        return Optional.ofNullable(driftType);
    }
}
