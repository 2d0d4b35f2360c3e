package com.densityviz.service;

import com.densityviz.core.Coordinate;
import com.densityviz.core.GridGeometry;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.SampleReadException;
import com.densityviz.io.SharedFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Samples one slice of a file's grid once, then optionally keeps refining
 * random cells until cancelled. Opens its own reader.
 */
public class SamplingWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(SamplingWorker.class);

    /**
     * Hooks into the session that started the worker.
     */
    public interface Callbacks {

        /**
         * One first-pass coordinate has been visited; {@code score} is
         * {@link RegionSampler#NO_SAMPLE} if the read failed or was empty.
         */
        void onFirstPassSample(int x, int y, int score);

        void onSliceComplete();

        /**
         * Block until every worker has finished its slice.
         *
         * @return false if the session was cancelled while waiting
         */
        boolean awaitFirstPass(CancellationToken token) throws InterruptedException;

        void onRefineSample(int x, int y, int score);

        void onReadFailure(SampleReadException e);

        void onOpenFailure(FileOpenException e);
    }

    private final Path file;
    private final List<Coordinate> slice;
    private final GridGeometry geometry;
    private final RegionSampler sampler;
    private final CancellationToken token;
    private final Callbacks callbacks;
    private final boolean persistent;
    private final long refineIntervalMs;
    private final ReaderOpener opener;

    public SamplingWorker(Path file, List<Coordinate> slice, RegionSampler sampler,
                          CancellationToken token, Callbacks callbacks,
                          boolean persistent, long refineIntervalMs) {
        this(file, slice, sampler, token, callbacks, persistent, refineIntervalMs, ReaderOpener.SHARED);
    }

    SamplingWorker(Path file, List<Coordinate> slice, RegionSampler sampler,
                   CancellationToken token, Callbacks callbacks,
                   boolean persistent, long refineIntervalMs, ReaderOpener opener) {
        this.file = file;
        this.slice = slice;
        this.geometry = sampler.getMapper().getGeometry();
        this.sampler = sampler;
        this.token = token;
        this.callbacks = callbacks;
        this.persistent = persistent;
        this.refineIntervalMs = refineIntervalMs;
        this.opener = opener;
    }

    public List<Coordinate> getSlice() {
        return slice;
    }

    @Override
    public void run() {
        Random random = ThreadLocalRandom.current();
        logger.debug("Worker starting on {} coordinates of {}", slice.size(), file.getFileName());

        try (SharedFileReader reader = opener.open(file)) {
            for (Coordinate c : slice) {
                if (token.isCancelled()) {
                    return;
                }
                callbacks.onFirstPassSample(c.getX(), c.getY(), sampleOnce(reader, c.getX(), c.getY(), random));
            }
            callbacks.onSliceComplete();

            if (!persistent || !callbacks.awaitFirstPass(token)) {
                return;
            }

            while (!token.isCancelled()) {
                int x = random.nextInt(geometry.getWidth());
                int y = random.nextInt(geometry.getHeight());
                int score = sampleOnce(reader, x, y, random);
                if (score != RegionSampler.NO_SAMPLE) {
                    callbacks.onRefineSample(x, y, score);
                }
                if (refineIntervalMs > 0) {
                    Thread.sleep(refineIntervalMs);
                }
            }
        } catch (FileOpenException e) {
            callbacks.onOpenFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Worker interrupted, exiting");
        } catch (IOException e) {
            logger.warn("Failed to close reader for {}", file, e);
        } finally {
            logger.debug("Worker on {} finished", file.getFileName());
        }
    }

    private int sampleOnce(SharedFileReader reader, int x, int y, Random random) {
        try {
            return sampler.sample(reader, x, y, random);
        } catch (SampleReadException e) {
            callbacks.onReadFailure(e);
            return RegionSampler.NO_SAMPLE;
        }
    }
}
