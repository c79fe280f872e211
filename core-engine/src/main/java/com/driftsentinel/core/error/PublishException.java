package com.driftsentinel.core.error;

/**
 * The telemetry backend was unreachable or rejected a metric batch.
 *
 * <p>
 * Never invalidates the drift report that produced the metrics.
 * </p>
 *
 * @since 1.0.0
 */
public class PublishException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
