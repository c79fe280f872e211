package com.driftsentinel.core.error;

import com.driftsentinel.core.model.DriftType;

/**
 * Too few samples to run a statistical test or compute an accuracy figure.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(null, message, null);
    }

    public InsufficientDataException(DriftType driftType, String message) {
        super(driftType, message, null);
    }

    public InsufficientDataException(DriftType driftType, String message, Throwable cause) {
        super(driftType, message, cause);
    }
}
