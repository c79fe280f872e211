package com.driftsentinel.core.error;

/**
 * The data source could not supply a snapshot for the requested model and
 * environment.
 *
 * @since 1.0.0
 */
public class DataSourceException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
