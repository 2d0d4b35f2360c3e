package com.densityviz.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by a controller and its workers. Workers check
 * it once per loop iteration, never in the middle of a read.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
