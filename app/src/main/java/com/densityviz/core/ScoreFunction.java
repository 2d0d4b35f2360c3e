package com.densityviz.core;

/**
 * Computes a diversity score for a window of sampled bytes.
 */
public interface ScoreFunction {

    /**
     * Score a window of bytes.
     *
     * @param window Sampled bytes
     * @param offset Starting offset
     * @param length Number of bytes to score, at least 1
     * @return Score in {@code [1, length]}
     */
    int score(byte[] window, int offset, int length);

    default int score(byte[] window) {
        return score(window, 0, window.length);
    }

    /**
     * Get function name.
     */
    String getName();
}
