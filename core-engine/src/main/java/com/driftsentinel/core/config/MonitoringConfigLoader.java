package com.driftsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the drift thresholds, metric namespace and detection mode from
 * {@code monitoring.yml}.
 *
 * <p>
 * The file is bound straight onto {@link MonitoringConfig}: an unknown or
 * misspelled key (say {@code treshold}) or a repeated key is a parse error,
 * not a silently ignored setting. An empty file, or no file at all on the
 * classpath, means every drift type is judged against the default threshold
 * of 0.10 and metrics go to {@value MonitoringConfig#DEFAULT_NAMESPACE}.
 * </p>
 *
 * <p>
 * Thresholds are validated right after parsing, so a value outside [0, 1]
 * stops the job before any snapshot is fetched.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringConfigLoader.class);

    /** Points a deployment at its own thresholds file. */
    public static final String ENV_CONFIG_PATH = "MONITORING_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "monitoring.yml";

    private MonitoringConfigLoader() {
        // not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the settings for a job that was given no explicit file: the file
     * named by {@value #ENV_CONFIG_PATH} when it exists, else the bundled
     * {@value #DEFAULT_RESOURCE}, else the defaults.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static MonitoringConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading monitoring config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (MonitoringConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on the classpath, using default monitoring config", DEFAULT_RESOURCE);
            return new MonitoringConfig();
        }
        LOG.info("Loading monitoring config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static MonitoringConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Monitoring config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read monitoring config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static MonitoringConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = MonitoringConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static MonitoringConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(MonitoringConfig.class, options));

        MonitoringConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed monitoring config " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Monitoring config {} is empty, using defaults", source);
            config = new MonitoringConfig();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
