package com.densityviz.service;

import com.densityviz.core.Coordinate;

import java.nio.file.Path;

/**
 * A coordinate of a particular file, scheduled for one batch tick.
 */
public final class BatchSample {

    private final Path file;
    private final Coordinate coordinate;

    public BatchSample(Path file, Coordinate coordinate) {
        this.file = file;
        this.coordinate = coordinate;
    }

    public Path getFile() {
        return file;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    @Override
    public String toString() {
        return file.getFileName() + " " + coordinate;
    }
}
