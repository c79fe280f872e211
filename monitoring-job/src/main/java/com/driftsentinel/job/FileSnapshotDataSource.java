package com.driftsentinel.job;

import com.driftsentinel.core.error.DataSourceException;
import com.driftsentinel.core.model.MonitoringSnapshot;
import com.driftsentinel.core.monitor.DriftDataSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link DriftDataSource} backed by JSON snapshot files on local disk.
 *
 * <p>
 * Layout mirrors the object-store bucket the data is exported to:
 * </p>
 *
 * <pre>
 *   {root}/mlops-data-{environment}/monitoring/{modelId}/snapshot.json
 * </pre>
 *
 * <p>
 * Local reads are not interruptible, so the timeout is only logged.
 * </p>
 */
public class FileSnapshotDataSource implements DriftDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotDataSource.class);

    static final String SNAPSHOT_FILE = "snapshot.json";

    private final Path root;
    private final ObjectMapper mapper = JsonMappers.newObjectMapper();

    public FileSnapshotDataSource(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Resolve the snapshot location for a model.
     */
    public Path snapshotPath(String modelId, String environment) {
        return root.resolve("mlops-data-" + environment)
                .resolve("monitoring")
                .resolve(modelId)
                .resolve(SNAPSHOT_FILE);
    }

    @Override
    public MonitoringSnapshot fetch(String modelId, String environment, Duration timeout) {
        Path path = snapshotPath(modelId, environment);
        LOG.debug("Reading snapshot {} (timeout {})", path, timeout);

        if (!Files.isRegularFile(path)) {
            throw new DataSourceException("No snapshot for model '" + modelId + "' in '"
                    + environment + "': " + path + " does not exist");
        }
        try {
            MonitoringSnapshot snapshot = mapper.readValue(path.toFile(), MonitoringSnapshot.class);
            if (snapshot == null) {
                throw new DataSourceException("Snapshot file is empty: " + path);
            }
            LOG.info("Loaded snapshot for [{}] in [{}]: {} feature(s), {} current row(s), {} baseline row(s)",
                    modelId, environment, snapshot.getFeatures().size(),
                    snapshot.getCurrent().rowCount(), snapshot.getBaseline().rowCount());
            return snapshot;
        } catch (IOException e) {
            throw new DataSourceException("Failed to read snapshot " + path + ": " + e.getMessage(), e);
        }
    }
}
