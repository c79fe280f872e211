package com.driftsentinel.core.monitor;

import com.driftsentinel.core.error.DataSourceException;
import com.driftsentinel.core.model.MonitoringSnapshot;

import java.time.Duration;

/**
 * Supplies baseline and current data for a model in an environment.
 *
 * <p>
 * Where the data lives (object storage, a feature store, local files) is up
 * to the implementation.
 * </p>
 *
 * @since 1.0.0
 */
public interface DriftDataSource {

    /**
     * Fetch the snapshot for one monitoring run.
     *
     * @param modelId     model identifier
     * @param environment deployment environment, e.g. {@code prod}
     * @param timeout     upper bound on how long the fetch may block
     * @return the snapshot
     * @throws DataSourceException if the data cannot be obtained
     */
    MonitoringSnapshot fetch(String modelId, String environment, Duration timeout);
}
