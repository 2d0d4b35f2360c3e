package com.densityviz.service;

import com.densityviz.core.CellAggregator;
import com.densityviz.core.Coordinate;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.core.SampleEvent;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.io.SharedFileReader;
import com.densityviz.model.SamplingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Samples every file of a directory side by side on a shared budget.
 *
 * <p>Discovery runs on its own thread and adds files as it finds them. A
 * fixed-delay ticker then splits {@code batchSize} samples evenly over the
 * known files, takes each file's share from its shuffled cursor and divides
 * the combined list across one-shot workers. Finished workers are reclaimed
 * at every tick and the fixed pool runs no more than {@code poolSize} of
 * them at once.
 *
 * <p>A file added mid-run joins the next tick and shrinks everyone's share.
 */
public class MultiFileBatchScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MultiFileBatchScheduler.class);

    private final GridGeometry geometry;
    private final int sampleBytes;
    private final int poolSize;
    private final int batchSize;
    private final long tickIntervalMs;
    private final ScoreFunction scoreFunction;
    private final SampleEventBus eventBus;
    private final CellAggregator aggregator;
    private final SamplingMetrics metrics;
    private final Random random;

    private final Map<Path, FileSampleState> states = new LinkedHashMap<>();
    private final Object lifecycleLock = new Object();
    // Merges hold the read lock, removals the write lock
    private final Set<Path> activeFiles = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock removalLock = new ReentrantReadWriteLock();

    private SamplingWorkerPool batchPool;
    private ExecutorService discoveryExecutor;
    private ScheduledExecutorService ticker;
    private CancellationToken discoveryToken;
    private volatile boolean running;

    public MultiFileBatchScheduler(GridGeometry geometry, int sampleBytes, int poolSize,
                                   int batchSize, long tickIntervalMs,
                                   ScoreFunction scoreFunction, SampleEventBus eventBus) {
        this(geometry, sampleBytes, poolSize, batchSize, tickIntervalMs, scoreFunction, eventBus, new Random());
    }

    public MultiFileBatchScheduler(GridGeometry geometry, int sampleBytes, int poolSize,
                                   int batchSize, long tickIntervalMs,
                                   ScoreFunction scoreFunction, SampleEventBus eventBus,
                                   Random random) {
        if (sampleBytes <= 0 || poolSize <= 0 || batchSize <= 0 || tickIntervalMs <= 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid batch settings: sampleBytes=%d poolSize=%d batchSize=%d tickIntervalMs=%d",
                sampleBytes, poolSize, batchSize, tickIntervalMs));
        }
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.poolSize = poolSize;
        this.batchSize = batchSize;
        this.tickIntervalMs = tickIntervalMs;
        this.scoreFunction = scoreFunction;
        this.eventBus = eventBus;
        this.aggregator = new CellAggregator();
        this.metrics = new SamplingMetrics();
        this.random = random;
    }

    /**
     * Start discovering and sampling a directory, replacing any previous run.
     *
     * @throws FileOpenException If the directory does not exist
     */
    public void start(Path directory) throws FileOpenException {
        synchronized (lifecycleLock) {
            stop();
            if (!Files.isDirectory(directory)) {
                FileOpenException e = new FileOpenException(directory, "Directory does not exist");
                eventBus.onSessionError(e.getMessage(), e);
                throw e;
            }

            synchronized (states) {
                states.clear();
                activeFiles.clear();
            }
            aggregator.reset();
            metrics.reset();

            CancellationToken token = new CancellationToken();
            synchronized (this) {
                batchPool = new SamplingWorkerPool("batch", poolSize);
                discoveryToken = token;
                running = true;
            }

            discoveryExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "densityviz-discovery"));
            discoveryExecutor.execute(() -> discover(directory, token));

            ticker = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "densityviz-ticker"));
            ticker.scheduleWithFixedDelay(this::tickSafely, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);

            logger.info("Scanning {} with {} batch workers, {} samples every {} ms",
                directory, poolSize, batchSize, tickIntervalMs);
        }
    }

    private void discover(Path directory, CancellationToken token) {
        DirectoryScanner scanner = new DirectoryScanner(geometry, sampleBytes, metrics);
        try {
            int found = scanner.scan(directory, token, this::register);
            eventBus.onDiscoveryComplete(found);
        } catch (FileOpenException e) {
            logger.error("Discovery of {} failed", directory, e);
            eventBus.onSessionError(e.getMessage(), e);
        }
    }

    /**
     * Add a single file to the active set.
     *
     * @throws FileOpenException If the file is missing or unreadable
     * @throws FileTooSmallException If the file cannot fill the grid
     */
    public void addFile(Path file) throws FileOpenException, FileTooSmallException {
        SharedFileReader.checkMappable(file, geometry, sampleBytes);
        register(file);
    }

    private void register(Path file) {
        boolean added;
        synchronized (states) {
            added = states.putIfAbsent(file, new FileSampleState(file, geometry, random)) == null;
            activeFiles.add(file);
        }
        if (added) {
            metrics.increment(SamplingMetrics.Counter.FILES_DISCOVERED);
            logger.debug("Discovered {}", file);
            eventBus.onFileDiscovered(file);
        }
    }

    /**
     * Remove a file from the active set and drop its cells. Samples of the
     * file still in flight are discarded, so its cells stay gone.
     */
    public void removeFile(Path file) {
        removalLock.writeLock().lock();
        try {
            synchronized (states) {
                states.remove(file);
                activeFiles.remove(file);
            }
            aggregator.removeFile(file);
        } finally {
            removalLock.writeLock().unlock();
        }
    }

    /**
     * Per-file share of one tick's budget.
     */
    public int perFileBudget(int activeFiles) {
        return activeFiles == 0 ? 0 : Math.max(1, batchSize / activeFiles);
    }

    /**
     * Advance every file's cursor by its share of the budget and return the
     * combined samples, grouped by file in discovery order.
     */
    public List<BatchSample> planTick() {
        synchronized (states) {
            int share = perFileBudget(states.size());
            List<BatchSample> planned = new ArrayList<>(share * states.size());
            for (FileSampleState state : states.values()) {
                for (Coordinate c : state.next(share)) {
                    planned.add(new BatchSample(state.getFile(), c));
                }
            }
            return planned;
        }
    }

    /**
     * Run one tick: reclaim finished workers, plan the batch and dispatch it.
     * Workers still running from earlier ticks keep their pool threads; the
     * new slices queue behind them.
     *
     * @return Number of workers dispatched, 0 if not running or there is nothing to do
     */
    public synchronized int runTick() {
        if (!running) {
            return 0;
        }
        int live = batchPool.getLiveWorkerCount();
        if (live > 0) {
            metrics.increment(SamplingMetrics.Counter.TICKS_OVERLAPPED);
            logger.debug("{} workers of earlier ticks still running", live);
        }

        List<BatchSample> planned = planTick();
        if (planned.isEmpty()) {
            return 0;
        }

        List<List<BatchSample>> slices = SamplingWorkerPool.partition(planned, poolSize);
        for (List<BatchSample> slice : slices) {
            batchPool.submit(new BatchSamplingWorker(slice, geometry, sampleBytes, scoreFunction,
                batchPool.getToken(), metrics, this::emit));
        }
        metrics.increment(SamplingMetrics.Counter.TICKS_RUN);
        metrics.add(SamplingMetrics.Counter.WORKERS_DISPATCHED, slices.size());
        logger.debug("Dispatched {} samples over {} workers", planned.size(), slices.size());
        return slices.size();
    }

    private void tickSafely() {
        try {
            runTick();
        } catch (RuntimeException e) {
            // An exception would cancel the scheduled ticker
            logger.error("Batch tick failed", e);
        }
    }

    private void emit(SampleEvent event) {
        removalLock.readLock().lock();
        try {
            if (!activeFiles.contains(event.getFile())) {
                metrics.increment(SamplingMetrics.Counter.SAMPLES_DROPPED);
                return;
            }
            aggregator.merge(event);
        } finally {
            removalLock.readLock().unlock();
        }
        metrics.increment(SamplingMetrics.Counter.SAMPLES_EMITTED);
        eventBus.onSample(event);
    }

    /**
     * Stop discovery, the ticker and every live worker, waiting for all of
     * them to return.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            synchronized (this) {
                if (!running) {
                    return;
                }
                // Ticks that start from here on do nothing
                running = false;
                discoveryToken.cancel();
            }
            ticker.shutdown();
            discoveryExecutor.shutdown();
            try {
                ticker.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
                discoveryExecutor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while stopping file set scheduler");
            }
            batchPool.stopAndJoin();
            metrics.markEnd();
            logger.info("File set sampling stopped after {} samples",
                metrics.get(SamplingMetrics.Counter.SAMPLES_EMITTED));
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Active files in discovery order.
     */
    public List<Path> getActiveFiles() {
        synchronized (states) {
            return new ArrayList<>(states.keySet());
        }
    }

    public FileSampleState getFileState(Path file) {
        synchronized (states) {
            return states.get(file);
        }
    }

    public static long minimumFileSize(GridGeometry geometry, int sampleBytes) {
        return RegionMapper.minimumFileSize(geometry, sampleBytes);
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
    public void close() {
        stop();
    }

    private static Thread daemon(Runnable r, String name) {
        Thread thread = new Thread(r, name);
        thread.setDaemon(true);
        return thread;
    }
}
