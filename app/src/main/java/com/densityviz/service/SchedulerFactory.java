package com.densityviz.service;

import com.densityviz.config.AppConfig;
import com.densityviz.core.DistinctByteScoreFunction;
import com.densityviz.core.ScoreFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating schedulers from configuration.
 */
public class SchedulerFactory {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerFactory.class);

    public static ScoreFunction createScoreFunction(AppConfig config) {
        return new DistinctByteScoreFunction();
    }

    /**
     * Create the scheduler for the main single-file view.
     */
    public static SingleFileScheduler createSingleFileScheduler(AppConfig config, SampleEventBus eventBus) {
        logger.debug("Creating single-file scheduler: grid {}, {} workers",
            config.getSingleFileGeometry(), config.getWorkerThreads());
        return new SingleFileScheduler(
            config.getSingleFileGeometry(),
            config.getBytesPerSample(),
            config.getWorkerThreads(),
            config.getRefineIntervalMs(),
            createScoreFunction(config),
            eventBus);
    }

    /**
     * Create the scheduler for the file-set view.
     */
    public static MultiFileBatchScheduler createMultiFileScheduler(AppConfig config, SampleEventBus eventBus) {
        logger.debug("Creating file-set scheduler: grid {}, batch {} every {} ms",
            config.getFileSetGeometry(), config.getBatchSize(), config.getTickIntervalMs());
        return new MultiFileBatchScheduler(
            config.getFileSetGeometry(),
            config.getBytesPerSample(),
            config.getWorkerThreads(),
            config.getBatchSize(),
            config.getTickIntervalMs(),
            createScoreFunction(config),
            eventBus);
    }

    public static ExportRenderer createExportRenderer(AppConfig config, SampleEventBus eventBus) {
        return new ExportRenderer(createScoreFunction(config), eventBus);
    }
}
