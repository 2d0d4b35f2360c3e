package com.densityviz.service;

import com.densityviz.core.Coordinate;
import com.densityviz.core.GridGeometry;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Tests for the per-file shuffled cursor.
 */
class FileSampleStateTest {

    @Test
    void testFullCoverageBeforeRepeat() {
        GridGeometry geometry = new GridGeometry(10, 10);
        FileSampleState state = new FileSampleState(Paths.get("f.bin"), geometry, new Random(3));

        // Odd chunk size so the wrap happens in the middle of a take
        List<Coordinate> taken = new ArrayList<>();
        while (taken.size() < 300) {
            taken.addAll(state.next(7));
        }

        for (int cycle = 0; cycle < 3; cycle++) {
            Set<Coordinate> window = new HashSet<>(taken.subList(cycle * 100, cycle * 100 + 100));
            assertEquals(100, window.size(), "Repeat inside cycle " + cycle);
        }
        assertEquals(3, state.getCompletedCycles());
    }

    @Test
    void testCursorAdvancesAndWraps() {
        FileSampleState state = new FileSampleState(Paths.get("f.bin"), new GridGeometry(5, 2), new Random(1));

        assertEquals(4, state.next(4).size());
        assertEquals(4, state.getCursor());
        assertEquals(6, state.next(6).size());
        assertEquals(0, state.getCursor());
        assertEquals(1, state.getCompletedCycles());
        assertEquals(3, state.next(3).size());
        assertEquals(3, state.getCursor());
    }

    @Test
    void testTakeLargerThanGrid() {
        FileSampleState state = new FileSampleState(Paths.get("f.bin"), new GridGeometry(2, 2), new Random(1));

        List<Coordinate> taken = state.next(10);

        assertEquals(10, taken.size());
        assertEquals(4, new HashSet<>(taken.subList(0, 4)).size());
        assertEquals(2, state.getCompletedCycles());
        assertEquals(2, state.getCursor());
    }
}
