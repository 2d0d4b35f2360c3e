package com.densityviz.service;

import com.densityviz.core.Coordinate;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.core.SampleEvent;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.SampleReadException;
import com.densityviz.io.SharedFileReader;
import com.densityviz.model.SamplingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * One-shot worker for a slice of a batch tick. Samples are grouped by file
 * so each file is opened once per worker.
 */
public class BatchSamplingWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(BatchSamplingWorker.class);

    private final List<BatchSample> samples;
    private final GridGeometry geometry;
    private final int sampleBytes;
    private final ScoreFunction scoreFunction;
    private final CancellationToken token;
    private final SamplingMetrics metrics;
    private final Consumer<SampleEvent> sink;

    public BatchSamplingWorker(List<BatchSample> samples, GridGeometry geometry, int sampleBytes,
                               ScoreFunction scoreFunction, CancellationToken token,
                               SamplingMetrics metrics, Consumer<SampleEvent> sink) {
        this.samples = samples;
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.scoreFunction = scoreFunction;
        this.token = token;
        this.metrics = metrics;
        this.sink = sink;
    }

    @Override
    public void run() {
        Map<Path, List<Coordinate>> byFile = new LinkedHashMap<>();
        for (BatchSample sample : samples) {
            byFile.computeIfAbsent(sample.getFile(), f -> new ArrayList<>()).add(sample.getCoordinate());
        }

        Random random = ThreadLocalRandom.current();
        for (Map.Entry<Path, List<Coordinate>> entry : byFile.entrySet()) {
            if (token.isCancelled()) {
                return;
            }
            sampleFile(entry.getKey(), entry.getValue(), random);
        }
    }

    private void sampleFile(Path file, List<Coordinate> coordinates, Random random) {
        try (SharedFileReader reader = SharedFileReader.open(file)) {
            // Re-read the size: the file may have changed since discovery
            long size = reader.size();
            if (!RegionMapper.canMap(size, geometry, sampleBytes)) {
                metrics.add(SamplingMetrics.Counter.SAMPLES_DROPPED, coordinates.size());
                logger.debug("{} shrank to {} bytes, skipping {} samples", file.getFileName(), size, coordinates.size());
                return;
            }
            RegionSampler sampler = new RegionSampler(new RegionMapper(size, geometry, sampleBytes), scoreFunction);

            for (Coordinate c : coordinates) {
                if (token.isCancelled()) {
                    return;
                }
                try {
                    int score = sampler.sample(reader, c.getX(), c.getY(), random);
                    if (score != RegionSampler.NO_SAMPLE) {
                        sink.accept(new SampleEvent(file, c.getX(), c.getY(), score));
                    } else {
                        metrics.increment(SamplingMetrics.Counter.SAMPLES_EMPTY);
                    }
                } catch (SampleReadException e) {
                    metrics.increment(SamplingMetrics.Counter.READ_FAILURES);
                    logger.trace("Skipping sample of {}", file, e);
                }
            }
        } catch (FileOpenException e) {
            metrics.increment(SamplingMetrics.Counter.OPEN_FAILURES);
            logger.warn("Cannot open {} for this batch: {}", file, e.getMessage());
        } catch (IOException e) {
            metrics.increment(SamplingMetrics.Counter.READ_FAILURES);
            logger.warn("I/O error sampling {}", file, e);
        }
    }
}
