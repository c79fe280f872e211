/**
 * Metric emission for drift reports.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.publish;
