package com.densityviz.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of sampling workers sharing one cancellation token.
 *
 * Stopping is cooperative: {@link #stopAndJoin()} raises the token and then
 * waits for every submitted worker to return. Workers are never interrupted.
 */
public class SamplingWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SamplingWorkerPool.class);
    private static final long JOIN_LOG_INTERVAL_MS = 5_000;

    private final String name;
    private final int size;
    private final ExecutorService executor;
    private final CancellationToken token;
    private final List<Future<?>> futures = new ArrayList<>();

    public SamplingWorkerPool(String name, int size) {
        this(name, size, new CancellationToken());
    }

    public SamplingWorkerPool(String name, int size, CancellationToken token) {
        if (size <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + size);
        }
        this.name = name;
        this.size = size;
        this.token = token;
        this.executor = Executors.newFixedThreadPool(size, new WorkerThreadFactory(name));
        logger.debug("Created {} worker pool with {} threads", name, size);
    }

    /**
     * Split items into {@code parts} contiguous slices whose sizes differ by
     * at most one. Every item lands in exactly one slice; empty slices are
     * dropped when there are fewer items than parts.
     */
    public static <T> List<List<T>> partition(List<T> items, int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("Number of parts must be positive: " + parts);
        }
        List<List<T>> slices = new ArrayList<>(parts);
        int total = items.size();
        for (int i = 0; i < parts; i++) {
            int from = (int) ((long) i * total / parts);
            int to = (int) ((long) (i + 1) * total / parts);
            if (to > from) {
                slices.add(Collections.unmodifiableList(new ArrayList<>(items.subList(from, to))));
            }
        }
        return slices;
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    public CancellationToken getToken() {
        return token;
    }

    public synchronized Future<?> submit(Runnable worker) {
        Future<?> future = executor.submit(worker);
        futures.add(future);
        return future;
    }

    /**
     * Number of submitted workers that have not returned yet.
     */
    public synchronized int getLiveWorkerCount() {
        futures.removeIf(Future::isDone);
        return futures.size();
    }

    /**
     * Accept no further workers; already submitted ones run to completion.
     */
    public void shutdown() {
        executor.shutdown();
    }

    public void requestStop() {
        token.cancel();
    }

    public boolean isStopRequested() {
        return token.isCancelled();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Raise the cancellation token and wait for every worker to finish.
     *
     * @return true if all workers returned, false if the wait was interrupted
     */
    public boolean stopAndJoin() {
        requestStop();
        executor.shutdown();
        try {
            while (!executor.awaitTermination(JOIN_LOG_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                logger.info("Waiting for {} workers to finish...", name);
            }
            logger.debug("All {} workers joined", name);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while joining {} workers", name);
            return false;
        }
    }

    @Override
    public void close() {
        stopAndJoin();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String name) {
            this.prefix = "densityviz-" + name + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
