package com.densityviz.service;

import com.densityviz.core.Coordinate;
import com.densityviz.core.GridGeometry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffled coordinate cursor for one file of a file set. Every coordinate is
 * handed out once before any repeats; the sequence is reshuffled each time it
 * wraps. Not thread-safe.
 */
public class FileSampleState {

    private final Path file;
    private final List<Coordinate> sequence;
    private final Random random;
    private int cursor;
    private long completedCycles;

    public FileSampleState(Path file, GridGeometry geometry, Random random) {
        this.file = file;
        this.random = random;
        this.sequence = geometry.allCoordinates();
        Collections.shuffle(sequence, random);
    }

    public Path getFile() {
        return file;
    }

    public int getCursor() {
        return cursor;
    }

    /**
     * Number of times the whole sequence has been handed out.
     */
    public long getCompletedCycles() {
        return completedCycles;
    }

    /**
     * Take the next {@code count} coordinates, wrapping into a freshly
     * shuffled sequence if the current one runs out.
     */
    public List<Coordinate> next(int count) {
        List<Coordinate> taken = new ArrayList<>(count);
        while (taken.size() < count) {
            int end = Math.min(sequence.size(), cursor + count - taken.size());
            taken.addAll(sequence.subList(cursor, end));
            cursor = end;
            if (cursor == sequence.size()) {
                cursor = 0;
                completedCycles++;
                Collections.shuffle(sequence, random);
            }
        }
        return taken;
    }
}
