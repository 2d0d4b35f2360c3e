package com.densityviz.service;

import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.core.SampleEvent;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.io.SampleReadException;
import com.densityviz.io.SharedFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * Renders a file once onto a caller-sized grid, one sample per pixel,
 * scanning row by row. Nothing is aggregated or kept after the call.
 */
public class ExportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ExportRenderer.class);

    private final ScoreFunction scoreFunction;
    private final SampleEventBus eventBus;
    private final Random random;
    private volatile CancellationToken currentToken = new CancellationToken();

    public ExportRenderer(ScoreFunction scoreFunction, SampleEventBus eventBus) {
        this(scoreFunction, eventBus, new Random());
    }

    public ExportRenderer(ScoreFunction scoreFunction, SampleEventBus eventBus, Random random) {
        this.scoreFunction = scoreFunction;
        this.eventBus = eventBus;
        this.random = random;
    }

    /**
     * Render a file. Publishes a sample and a progress event per pixel and
     * an export-complete event at the end.
     *
     * @throws FileOpenException If the file is missing or unreadable
     * @throws FileTooSmallException If the file cannot fill the grid
     */
    public ExportResult render(Path file, GridGeometry geometry, int sampleBytes) throws IOException {
        CancellationToken token = new CancellationToken();
        currentToken = token;

        long fileSize;
        try {
            fileSize = SharedFileReader.checkMappable(file, geometry, sampleBytes);
        } catch (FileOpenException | FileTooSmallException e) {
            eventBus.onSessionError(e.getMessage(), e);
            throw e;
        }

        RegionSampler sampler = new RegionSampler(new RegionMapper(fileSize, geometry, sampleBytes), scoreFunction);
        int width = geometry.getWidth();
        int height = geometry.getHeight();
        long total = geometry.getTotalPoints();
        int[] scores = new int[geometry.getTotalPoints()];
        long processed = 0;
        long written = 0;
        int failures = 0;
        boolean complete = true;

        logger.info("Exporting {} at {}x{} with {}-byte samples", file.getFileName(), width, height, sampleBytes);
        long start = System.nanoTime();

        try (SharedFileReader reader = SharedFileReader.open(file)) {
            scan:
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (token.isCancelled()) {
                        complete = false;
                        break scan;
                    }
                    try {
                        int score = sampler.sample(reader, x, y, random);
                        if (score != RegionSampler.NO_SAMPLE) {
                            scores[y * width + x] = score;
                            written++;
                            eventBus.onSample(new SampleEvent(file, x, y, score));
                        }
                    } catch (SampleReadException e) {
                        failures++;
                        logger.trace("Skipping pixel ({}, {})", x, y, e);
                    }
                    processed++;
                    eventBus.onProgress(processed, total);
                }
            }
        }

        ExportResult result = new ExportResult(file, geometry, sampleBytes, scores, written, complete);
        logger.info("Export of {} {} in {} ms: {} pixels, {} read failures",
            file.getFileName(), complete ? "finished" : "cancelled",
            (System.nanoTime() - start) / 1_000_000, written, failures);
        if (complete) {
            eventBus.onExportComplete(result);
        }
        return result;
    }

    /**
     * Stop a render in progress after the current pixel. Has no effect on a
     * render that starts later.
     */
    public void cancel() {
        currentToken.cancel();
    }
}
