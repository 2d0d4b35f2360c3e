package com.densityviz.core;

/**
 * Committed running total for one grid cell. Instances are immutable; every
 * merge replaces the cell, so a reader always sees a total and a count that
 * belong together.
 */
public final class GridCell {

    private final long totalScore;
    private final long count;

    GridCell(long totalScore, long count) {
        this.totalScore = totalScore;
        this.count = count;
    }

    static GridCell first(int score) {
        return new GridCell(score, 1);
    }

    GridCell plus(int score) {
        return new GridCell(totalScore + score, count + 1);
    }

    public long getTotalScore() {
        return totalScore;
    }

    public long getCount() {
        return count;
    }

    public double getAverage() {
        return (double) totalScore / count;
    }

    @Override
    public String toString() {
        return String.format("GridCell[total=%d, count=%d, avg=%.3f]", totalScore, count, getAverage());
    }
}
