package com.densityviz.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical grid a file is mapped onto: a fixed number of cells per axis,
 * independent of the file size.
 */
public final class GridGeometry {

    private final int width;
    private final int height;
    private final int totalPoints;

    public GridGeometry(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Grid dimensions must be positive: " + width + "x" + height);
        }
        long total = (long) width * height;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid too large: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.totalPoints = (int) total;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Linear region index of a cell. Columns are laid out one after another,
     * so neighbouring cells in a column map to neighbouring regions.
     */
    public long indexOf(int x, int y) {
        if (!contains(x, y)) {
            throw new IllegalArgumentException(
                "Coordinate (" + x + ", " + y + ") outside " + this);
        }
        return (long) x * height + y;
    }

    /**
     * Every coordinate of the grid, row by row.
     */
    public List<Coordinate> allCoordinates() {
        List<Coordinate> coordinates = new ArrayList<>(totalPoints);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                coordinates.add(new Coordinate(x, y));
            }
        }
        return coordinates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridGeometry)) return false;
        GridGeometry other = (GridGeometry) o;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return 31 * width + height;
    }

    @Override
    public String toString() {
        return width + "x" + height + " (" + totalPoints + " cells)";
    }
}
