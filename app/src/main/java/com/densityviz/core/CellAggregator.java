package com.densityviz.core;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe running-average store for one visualization context.
 *
 * Cells are keyed by grid coordinate and, in multi-file mode, by file.
 * Merges run inside {@link ConcurrentHashMap#compute}, which is atomic per
 * key, and replace the immutable {@link GridCell}, so concurrent writers to
 * the same cell never lose an update and readers never see a torn cell.
 */
public class CellAggregator {

    private final Map<CellKey, GridCell> cells = new ConcurrentHashMap<>();
    private final LongAdder merges = new LongAdder();

    public GridCell merge(int x, int y, int score) {
        return merge(null, x, y, score);
    }

    public GridCell merge(SampleEvent event) {
        return merge(event.getFile(), event.getX(), event.getY(), event.getScore());
    }

    /**
     * Add one score to a cell, creating the cell on first touch.
     *
     * @return The committed cell after this merge
     */
    public GridCell merge(Path file, int x, int y, int score) {
        if (score < 1) {
            throw new IllegalArgumentException("Score must be at least 1: " + score);
        }
        GridCell merged = cells.compute(new CellKey(file, x, y),
            (key, cell) -> cell == null ? GridCell.first(score) : cell.plus(score));
        merges.increment();
        return merged;
    }

    /**
     * Committed cell, or {@code null} if never sampled.
     */
    public GridCell get(int x, int y) {
        return cells.get(new CellKey(null, x, y));
    }

    public GridCell get(Path file, int x, int y) {
        return cells.get(new CellKey(file, x, y));
    }

    /**
     * Immutable copy of the single-file cells.
     */
    public Map<Coordinate, GridCell> snapshot() {
        return snapshot(null);
    }

    public Map<Coordinate, GridCell> snapshot(Path file) {
        Map<Coordinate, GridCell> copy = new HashMap<>();
        cells.forEach((key, cell) -> {
            if (Objects.equals(key.file, file)) {
                copy.put(new Coordinate(key.x, key.y), cell);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Dense row-major grid of averages ({@code y * width + x}); unsampled
     * cells are {@link Double#NaN}.
     */
    public double[] averageGrid(GridGeometry geometry) {
        return averageGrid(null, geometry);
    }

    public double[] averageGrid(Path file, GridGeometry geometry) {
        double[] grid = new double[geometry.getTotalPoints()];
        Arrays.fill(grid, Double.NaN);
        cells.forEach((key, cell) -> {
            if (Objects.equals(key.file, file) && geometry.contains(key.x, key.y)) {
                grid[key.y * geometry.getWidth() + key.x] = cell.getAverage();
            }
        });
        return grid;
    }

    public Set<Path> files() {
        Set<Path> files = new LinkedHashSet<>();
        for (CellKey key : cells.keySet()) {
            if (key.file != null) {
                files.add(key.file);
            }
        }
        return files;
    }

    /**
     * Number of cells that hold at least one sample.
     */
    public int size() {
        return cells.size();
    }

    public long getTotalMerges() {
        return merges.sum();
    }

    public void removeFile(Path file) {
        cells.keySet().removeIf(key -> Objects.equals(key.file, file));
    }

    /**
     * Drop every cell. Callers must make sure no worker is still writing.
     */
    public void reset() {
        cells.clear();
        merges.reset();
    }

    private static final class CellKey {
        private final Path file;
        private final int x;
        private final int y;

        CellKey(Path file, int x, int y) {
            this.file = file;
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CellKey)) return false;
            CellKey other = (CellKey) o;
            return x == other.x && y == other.y && Objects.equals(file, other.file);
        }

        @Override
        public int hashCode() {
            return Objects.hash(file, x, y);
        }
    }
}
