package com.densityviz.config;

import com.densityviz.core.GridGeometry;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration wrapper.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private final Config config;

    public AppConfig() {
        this(ConfigFactory.load());
    }

    public AppConfig(Config config) {
        this.config = config.getConfig("densityviz");
    }

    // Sampling settings
    public int getBytesPerSample() {
        return config.getInt("sampling.bytes-per-sample");
    }

    public int getWorkerThreads() {
        int threads = config.getInt("sampling.worker-threads");
        if (threads <= 0) {
            threads = Runtime.getRuntime().availableProcessors();
            logger.debug("Worker threads not configured, using {} available processors", threads);
        }
        return threads;
    }

    public long getRefineIntervalMs() {
        return config.getLong("sampling.refine-interval-ms");
    }

    // Single-file grid
    public GridGeometry getSingleFileGeometry() {
        return new GridGeometry(
            config.getInt("single-file.grid-width"),
            config.getInt("single-file.grid-height"));
    }

    // File set settings
    public GridGeometry getFileSetGeometry() {
        return new GridGeometry(
            config.getInt("fileset.grid-width"),
            config.getInt("fileset.grid-height"));
    }

    public int getBatchSize() {
        return config.getInt("fileset.batch-size");
    }

    public long getTickIntervalMs() {
        return config.getLong("fileset.tick-interval-ms");
    }

    // Export settings
    public GridGeometry getExportGeometry() {
        return new GridGeometry(
            config.getInt("export.width"),
            config.getInt("export.height"));
    }

    public int getExportBytesPerSample() {
        return config.getInt("export.bytes-per-sample");
    }

    // Logging settings
    public boolean isMetricsEnabled() {
        return config.getBoolean("logging.metrics-enabled");
    }
}
