package com.densityviz.service;

import com.densityviz.core.CellAggregator;
import com.densityviz.core.Coordinate;
import com.densityviz.core.GridCell;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.core.SampleEvent;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.io.SampleReadException;
import com.densityviz.io.SharedFileReader;
import com.densityviz.model.SamplingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives sampling of one file onto one grid.
 *
 * A session shuffles every grid coordinate, hands each worker a disjoint
 * slice and samples each coordinate once. In persistent mode the workers then
 * keep sampling random cells until {@link #stop()} is called. Starting a new
 * file stops and joins the previous session before the aggregator is reset.
 */
public class SingleFileScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SingleFileScheduler.class);
    private static final long BARRIER_POLL_MS = 50;

    private final GridGeometry geometry;
    private final int sampleBytes;
    private final int workerCount;
    private final long refineIntervalMs;
    private final ScoreFunction scoreFunction;
    private final SampleEventBus eventBus;
    private final CellAggregator aggregator;
    private final SamplingMetrics metrics;
    private final Random shuffleRandom;

    private volatile SessionState state = SessionState.IDLE;
    private volatile Session session;
    private SamplingWorkerPool pool;
    private ReaderOpener readerOpener = ReaderOpener.SHARED;

    public SingleFileScheduler(GridGeometry geometry, int sampleBytes, int workerCount,
                               long refineIntervalMs, ScoreFunction scoreFunction,
                               SampleEventBus eventBus) {
        this(geometry, sampleBytes, workerCount, refineIntervalMs, scoreFunction, eventBus, new Random());
    }

    public SingleFileScheduler(GridGeometry geometry, int sampleBytes, int workerCount,
                               long refineIntervalMs, ScoreFunction scoreFunction,
                               SampleEventBus eventBus, Random shuffleRandom) {
        if (sampleBytes <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleBytes);
        }
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        if (refineIntervalMs < 0) {
            throw new IllegalArgumentException("Refine interval must not be negative: " + refineIntervalMs);
        }
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.workerCount = workerCount;
        this.refineIntervalMs = refineIntervalMs;
        this.scoreFunction = scoreFunction;
        this.eventBus = eventBus;
        this.aggregator = new CellAggregator();
        this.metrics = new SamplingMetrics();
        this.shuffleRandom = shuffleRandom;
    }

    /**
     * Start sampling a file, replacing any running session.
     *
     * @param file File to visualize
     * @param persistent Keep refining after the first pass
     * @throws FileOpenException If the file is missing or unreadable; no worker starts
     * @throws FileTooSmallException If the file cannot fill the grid; no worker starts
     */
    public synchronized void start(Path file, boolean persistent)
            throws FileOpenException, FileTooSmallException {
        stopAndJoin();
        aggregator.reset();
        metrics.reset();
        session = null;

        state = SessionState.DISCOVERING;
        long fileSize;
        try {
            fileSize = SharedFileReader.checkMappable(file, geometry, sampleBytes);
        } catch (FileOpenException | FileTooSmallException e) {
            state = SessionState.FAILED;
            logger.warn("Cannot sample {}: {}", file, e.getMessage());
            eventBus.onSessionError(e.getMessage(), e);
            throw e;
        }

        RegionMapper mapper = new RegionMapper(fileSize, geometry, sampleBytes);
        List<Coordinate> coordinates = geometry.allCoordinates();
        Collections.shuffle(coordinates, shuffleRandom);
        List<List<Coordinate>> slices = SamplingWorkerPool.partition(coordinates, workerCount);

        pool = new SamplingWorkerPool("sampler", slices.size());
        Session newSession = new Session(file, persistent, slices, pool.getToken());
        session = newSession;
        state = SessionState.FIRST_PASS;

        logger.info("Sampling {} ({} bytes) onto {} grid with {} workers, chunk size {} bytes{}",
            file.getFileName(), fileSize, geometry, slices.size(),
            String.format("%.2f", mapper.getChunkSize()), persistent ? ", persistent" : "");

        for (List<Coordinate> slice : slices) {
            pool.submit(new SamplingWorker(file, slice, new RegionSampler(mapper, scoreFunction),
                pool.getToken(), newSession, persistent, refineIntervalMs, readerOpener));
        }
        pool.shutdown();
    }

    /**
     * Ask every worker to stop and wait until all of them have returned.
     * After this returns no further events are published for the session.
     */
    public synchronized void stop() {
        if (stopAndJoin() && state != SessionState.IDLE) {
            logger.info("Sampling session stopped");
        }
    }

    private boolean stopAndJoin() {
        if (pool == null) {
            return false;
        }
        boolean joined = pool.stopAndJoin();
        pool = null;
        Session current = session;
        if (current != null) {
            current.settled.countDown();
        }
        metrics.markEnd();
        if (state.isActive()) {
            state = SessionState.STOPPED;
        }
        return joined;
    }

    /**
     * Wait for the first pass of the current session.
     *
     * @return true if it completed within the timeout, false on timeout or
     *         if the session failed or was stopped first
     */
    public boolean awaitFirstPass(long timeout, TimeUnit unit) throws InterruptedException {
        Session current = session;
        return current != null && current.settled.await(timeout, unit) && current.firstPassDone.getCount() == 0;
    }

    /**
     * Wait for every worker of the current session to return, which only
     * happens on its own in non-persistent mode.
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        SamplingWorkerPool current;
        synchronized (this) {
            current = pool;
        }
        return current == null || current.awaitTermination(timeout, unit);
    }

    /**
     * Look at one cell of the current file: its region start, the committed
     * cell and a fresh sample read from a random offset in its region.
     *
     * @throws IllegalStateException If no file has been started
     * @throws IllegalArgumentException If the cell is outside the grid
     * @throws FileOpenException If the file can no longer be opened
     * @throws FileTooSmallException If the file shrank below the grid minimum
     */
    public CellInspection inspect(int x, int y) throws IOException {
        Path file = getCurrentFile();
        if (file == null) {
            throw new IllegalStateException("No file is being sampled");
        }
        if (!geometry.contains(x, y)) {
            throw new IllegalArgumentException(String.format("Cell (%d, %d) is outside %s", x, y, geometry));
        }

        try (SharedFileReader reader = SharedFileReader.open(file)) {
            long size = reader.size();
            if (!RegionMapper.canMap(size, geometry, sampleBytes)) {
                throw new FileTooSmallException(file, size, RegionMapper.minimumFileSize(geometry, sampleBytes));
            }
            RegionMapper mapper = new RegionMapper(size, geometry, sampleBytes);
            long position = mapper.samplePosition(x, y, ThreadLocalRandom.current());
            byte[] buffer = new byte[sampleBytes];
            int read = Math.max(0, reader.readAt(position, buffer, sampleBytes));
            GridCell cell = aggregator.get(x, y);
            return new CellInspection(x, y, mapper.regionStart(x, y), position, cell, Arrays.copyOf(buffer, read));
        }
    }

    /**
     * Replace how workers open the file. Takes effect at the next start.
     */
    synchronized void setReaderOpener(ReaderOpener readerOpener) {
        this.readerOpener = readerOpener;
    }

    public SessionState getState() {
        return state;
    }

    public Path getCurrentFile() {
        Session current = session;
        return current != null ? current.file : null;
    }

    /**
     * Workers started by the current session, 0 if none.
     */
    public int getWorkerCount() {
        Session current = session;
        return current != null ? current.slices.size() : 0;
    }

    /**
     * Slices handed to the workers of the current session.
     */
    public List<List<Coordinate>> getAssignedSlices() {
        Session current = session;
        return current != null ? current.slices : List.of();
    }

    /**
     * First-pass progress in [0, 1].
     */
    public double getProgress() {
        Session current = session;
        return current != null ? (double) current.visited.get() / geometry.getTotalPoints() : 0;
    }

    public GridGeometry getGeometry() {
        return geometry;
    }

    public CellAggregator getAggregator() {
        return aggregator;
    }

    public SamplingMetrics getMetrics() {
        return metrics;
    }

    @Override
    public synchronized void close() {
        stopAndJoin();
        state = SessionState.CLOSED;
    }

    /**
     * Per-session bookkeeping. Workers only ever see their own session, so a
     * late callback can never touch the counters of a newer one.
     */
    private final class Session implements SamplingWorker.Callbacks {
        private final Path file;
        private final boolean persistent;
        private final List<List<Coordinate>> slices;
        private final AtomicLong visited = new AtomicLong();
        private final AtomicInteger slicesPending;
        private final CountDownLatch firstPassDone = new CountDownLatch(1);
        // Released by first-pass completion, failure or stop
        private final CountDownLatch settled = new CountDownLatch(1);
        private final AtomicBoolean failed = new AtomicBoolean();
        private final CancellationToken token;
        private final Object progressLock = new Object();
        private int lastPercent = -1;

        Session(Path file, boolean persistent, List<List<Coordinate>> slices, CancellationToken token) {
            this.file = file;
            this.token = token;
            this.persistent = persistent;
            this.slices = Collections.unmodifiableList(slices);
            this.slicesPending = new AtomicInteger(slices.size());
        }

        @Override
        public void onFirstPassSample(int x, int y, int score) {
            if (score != RegionSampler.NO_SAMPLE) {
                emit(x, y, score);
            } else {
                metrics.increment(SamplingMetrics.Counter.SAMPLES_EMPTY);
            }

            long processed = visited.incrementAndGet();
            long total = geometry.getTotalPoints();
            int percent = (int) (processed * 100 / total);
            synchronized (progressLock) {
                // Report each whole percent once, in order
                if (percent > lastPercent) {
                    lastPercent = percent;
                    eventBus.onProgress(processed, total);
                }
            }
        }

        @Override
        public void onSliceComplete() {
            if (slicesPending.decrementAndGet() == 0 && !failed.get()) {
                state = persistent ? SessionState.REFINING : SessionState.STOPPED;
                if (!persistent) {
                    metrics.markEnd();
                }
                logger.info("First pass of {} complete: {} samples", file.getFileName(),
                    metrics.get(SamplingMetrics.Counter.SAMPLES_EMITTED));
                firstPassDone.countDown();
                eventBus.onFirstPassComplete();
                settled.countDown();
            }
        }

        @Override
        public boolean awaitFirstPass(CancellationToken workerToken) throws InterruptedException {
            while (!workerToken.isCancelled()) {
                if (firstPassDone.await(BARRIER_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void onRefineSample(int x, int y, int score) {
            emit(x, y, score);
        }

        @Override
        public void onReadFailure(SampleReadException e) {
            metrics.increment(SamplingMetrics.Counter.READ_FAILURES);
            logger.trace("Skipping sample of {}", file, e);
        }

        @Override
        public void onOpenFailure(FileOpenException e) {
            metrics.increment(SamplingMetrics.Counter.OPEN_FAILURES);
            if (failed.compareAndSet(false, true)) {
                state = SessionState.FAILED;
                token.cancel();
                logger.error("Worker could not open {}, aborting session", file, e);
                eventBus.onSessionError(e.getMessage(), e);
                settled.countDown();
            }
        }

        private void emit(int x, int y, int score) {
            aggregator.merge(x, y, score);
            metrics.increment(SamplingMetrics.Counter.SAMPLES_EMITTED);
            eventBus.onSample(new SampleEvent(x, y, score));
        }
    }
}
