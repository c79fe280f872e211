/**
 * Typed failures of the drift-monitoring engine.
 *
 * <p>
 * Detection-time errors extend
 * {@link com.driftsentinel.core.error.DetectionException} and abort a run
 * before anything is published. {@link com.driftsentinel.core.error.DataSourceException}
 * aborts a run before detection starts.
 * {@link com.driftsentinel.core.error.PublishException} only signals that
 * metrics were not delivered.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.error;
