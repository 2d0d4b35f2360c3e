package com.densityviz.service;

import com.densityviz.core.GridGeometry;

import java.nio.file.Path;

/**
 * Per-pixel scores of a one-shot export, row-major. A score of 0 marks a
 * pixel whose read came back empty.
 */
public class ExportResult {

    private final Path file;
    private final GridGeometry geometry;
    private final int sampleBytes;
    private final int[] scores;
    private final long samplesWritten;
    private final boolean complete;

    public ExportResult(Path file, GridGeometry geometry, int sampleBytes, int[] scores,
                        long samplesWritten, boolean complete) {
        this.file = file;
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.scores = scores;
        this.samplesWritten = samplesWritten;
        this.complete = complete;
    }

    public Path getFile() {
        return file;
    }

    public GridGeometry getGeometry() {
        return geometry;
    }

    public int getSampleBytes() {
        return sampleBytes;
    }

    public int getScore(int x, int y) {
        return scores[y * geometry.getWidth() + x];
    }

    /**
     * Score mapped onto [0, 1] as {@code (score - 1) / (sampleBytes - 1)};
     * 0.5 when a window is a single byte.
     */
    public double normalized(int x, int y) {
        if (sampleBytes <= 1) {
            return 0.5;
        }
        return Math.max(0, getScore(x, y) - 1) / (double) (sampleBytes - 1);
    }

    public long getSamplesWritten() {
        return samplesWritten;
    }

    /**
     * False if the render was cancelled before visiting every pixel.
     */
    public boolean isComplete() {
        return complete;
    }

    public double getMeanScore() {
        long sum = 0;
        long count = 0;
        for (int score : scores) {
            if (score > 0) {
                sum += score;
                count++;
            }
        }
        return count == 0 ? 0 : (double) sum / count;
    }
}
