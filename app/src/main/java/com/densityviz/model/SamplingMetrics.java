package com.densityviz.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one sampling session. Safe to update from any worker thread.
 */
public class SamplingMetrics {

    public enum Counter {
        SAMPLES_EMITTED("Samples emitted"),
        SAMPLES_EMPTY("Empty reads"),
        READ_FAILURES("Read failures"),
        SAMPLES_DROPPED("Samples dropped"),
        OPEN_FAILURES("Open failures"),
        FILES_DISCOVERED("Files discovered"),
        ENTRIES_SKIPPED("Entries skipped"),
        TICKS_RUN("Batch ticks"),
        TICKS_OVERLAPPED("Ticks over a busy pool"),
        WORKERS_DISPATCHED("Workers dispatched");

        private final String displayName;

        Counter(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Map<Counter, LongAdder> counters;
    private volatile long startNanos;
    private volatile long endNanos;

    public SamplingMetrics() {
        this.counters = new EnumMap<>(Counter.class);
        for (Counter counter : Counter.values()) {
            counters.put(counter, new LongAdder());
        }
        this.startNanos = System.nanoTime();
    }

    public void increment(Counter counter) {
        counters.get(counter).increment();
    }

    public void add(Counter counter, long amount) {
        counters.get(counter).add(amount);
    }

    public long get(Counter counter) {
        return counters.get(counter).sum();
    }

    public void markStart() {
        startNanos = System.nanoTime();
        endNanos = 0;
    }

    public void markEnd() {
        endNanos = System.nanoTime();
    }

    /**
     * Elapsed time in seconds, up to now if the session is still running.
     */
    public double getElapsedSeconds() {
        long end = endNanos != 0 ? endNanos : System.nanoTime();
        return (end - startNanos) / 1_000_000_000.0;
    }

    /**
     * Emitted samples per second over the elapsed time.
     */
    public double getSamplesPerSecond() {
        double seconds = getElapsedSeconds();
        if (seconds == 0) return 0;
        return get(Counter.SAMPLES_EMITTED) / seconds;
    }

    /**
     * Get formatted summary of all non-zero counters.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Sampling Summary:\n");
        sb.append("═══════════════════════════════════════════════════\n");

        for (Counter counter : Counter.values()) {
            long value = get(counter);
            if (value != 0) {
                sb.append(String.format("%-27s: %,12d\n", counter.getDisplayName(), value));
            }
        }
        sb.append(String.format("%-27s: %12.2f s\n", "Elapsed", getElapsedSeconds()));
        sb.append(String.format("%-27s: %12.1f /s\n", "Throughput", getSamplesPerSecond()));

        return sb.toString();
    }

    /**
     * Reset all counters and restart the clock.
     */
    public void reset() {
        counters.values().forEach(LongAdder::reset);
        markStart();
    }
}
