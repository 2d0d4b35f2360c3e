package com.densityviz.service;

import com.densityviz.core.SampleEvent;

import java.nio.file.Path;

/**
 * Receives the engine's output. Callbacks arrive on worker threads and must
 * return quickly; every method has a no-op default.
 */
public interface SamplingListener {

    /**
     * A sample has been merged into the aggregator.
     */
    default void onSample(SampleEvent event) {
    }

    /**
     * First-pass or export progress, {@code processed} out of {@code total}.
     */
    default void onProgress(long processed, long total) {
    }

    default void onFirstPassComplete() {
    }

    /**
     * Terminal failure of a session; no samples follow.
     */
    default void onSessionError(String reason, Throwable cause) {
    }

    default void onFileDiscovered(Path file) {
    }

    default void onDiscoveryComplete(int discovered) {
    }

    default void onExportComplete(ExportResult result) {
    }
}
