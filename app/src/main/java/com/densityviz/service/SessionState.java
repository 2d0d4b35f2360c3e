package com.densityviz.service;

/**
 * Lifecycle of a single-file sampling session.
 */
public enum SessionState {
    IDLE,
    DISCOVERING,
    FIRST_PASS,
    REFINING,
    STOPPED,
    CLOSED,
    FAILED;

    public boolean isActive() {
        return this == DISCOVERING || this == FIRST_PASS || this == REFINING;
    }
}
