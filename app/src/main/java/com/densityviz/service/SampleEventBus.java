package com.densityviz.service;

import com.densityviz.core.SampleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans engine events out to any number of subscribers. Thread-safe; a
 * subscriber that throws is logged and does not affect the others.
 */
public class SampleEventBus implements SamplingListener {

    private static final Logger logger = LoggerFactory.getLogger(SampleEventBus.class);

    private final List<SamplingListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(SamplingListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(SamplingListener listener) {
        listeners.remove(listener);
    }

    public int getSubscriberCount() {
        return listeners.size();
    }

    @Override
    public void onSample(SampleEvent event) {
        publish(l -> l.onSample(event));
    }

    @Override
    public void onProgress(long processed, long total) {
        publish(l -> l.onProgress(processed, total));
    }

    @Override
    public void onFirstPassComplete() {
        publish(SamplingListener::onFirstPassComplete);
    }

    @Override
    public void onSessionError(String reason, Throwable cause) {
        publish(l -> l.onSessionError(reason, cause));
    }

    @Override
    public void onFileDiscovered(Path file) {
        publish(l -> l.onFileDiscovered(file));
    }

    @Override
    public void onDiscoveryComplete(int discovered) {
        publish(l -> l.onDiscoveryComplete(discovered));
    }

    @Override
    public void onExportComplete(ExportResult result) {
        publish(l -> l.onExportComplete(result));
    }

    private void publish(Consumer<SamplingListener> call) {
        for (SamplingListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                logger.error("Error notifying sampling listener", e);
            }
        }
    }
}
