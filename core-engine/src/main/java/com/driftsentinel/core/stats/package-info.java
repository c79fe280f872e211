/**
 * Distribution comparison primitives used by data-drift detection.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.stats;
