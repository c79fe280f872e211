/**
 * Drift detection.
 *
 * <p>
 * {@link com.driftsentinel.core.detection.DriftDetector} implements the three
 * detection operations against one
 * {@link com.driftsentinel.core.detection.ThresholdConfig}.
 * {@link com.driftsentinel.core.detection.DetectorSuite} assigns a detector to
 * each drift type, and
 * {@link com.driftsentinel.core.detection.DriftReportAggregator} combines
 * their results into a report.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.detection;
