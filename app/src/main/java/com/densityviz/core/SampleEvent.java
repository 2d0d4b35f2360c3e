package com.densityviz.core;

import java.nio.file.Path;

/**
 * One scored sample, produced by a single worker.
 */
public final class SampleEvent {

    private final Path file;
    private final int x;
    private final int y;
    private final int score;

    public SampleEvent(int x, int y, int score) {
        this(null, x, y, score);
    }

    public SampleEvent(Path file, int x, int y, int score) {
        this.file = file;
        this.x = x;
        this.y = y;
        this.score = score;
    }

    /**
     * Source file, or {@code null} in single-file mode.
     */
    public Path getFile() {
        return file;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "SampleEvent[" + (file != null ? file.getFileName() + " " : "")
            + "(" + x + ", " + y + ") = " + score + "]";
    }
}
