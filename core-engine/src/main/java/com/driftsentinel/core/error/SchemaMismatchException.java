package com.driftsentinel.core.error;

import com.driftsentinel.core.model.DriftType;

/**
 * Current and baseline inputs do not share the same shape: feature count,
 * row width or label alignment differ.
 *
 * @since 1.0.0
 */
public class SchemaMismatchException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message) {
        super(null, message, null);
    }

    public SchemaMismatchException(DriftType driftType, String message) {
        super(driftType, message, null);
    }
}
