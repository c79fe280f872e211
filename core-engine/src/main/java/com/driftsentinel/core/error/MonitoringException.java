package com.driftsentinel.core.error;

/**
 * Base type for every failure a monitoring run can report.
 *
 * <p>
 * Unchecked, like the rest of the engine's validation errors. Callers that
 * need to tell failures apart should match on the concrete subtype rather
 * than parse messages.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class MonitoringException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected MonitoringException(String message) {
        super(message);
    }

    protected MonitoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
