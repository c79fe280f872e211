package com.driftsentinel.core.error;

import com.driftsentinel.core.model.DriftType;

/**
 * Baseline cannot be used as a denominator (zero or non-finite mean).
 *
 * @since 1.0.0
 */
public class DegenerateBaselineException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public DegenerateBaselineException(DriftType driftType, String message) {
        super(driftType, message, null);
    }
}
