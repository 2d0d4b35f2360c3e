package com.densityviz.core;

/**
 * Scores a window by the number of distinct byte values it contains.
 * Order independent and linear in the window size.
 */
public class DistinctByteScoreFunction implements ScoreFunction {

    @Override
    public int score(byte[] window, int offset, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Cannot score an empty window");
        }
        if (offset < 0 || offset + length > window.length) {
            throw new IndexOutOfBoundsException(
                "Window [" + offset + ", " + (offset + length) + ") outside array of " + window.length);
        }

        boolean[] seen = new boolean[256];
        int distinct = 0;
        int end = offset + length;

        for (int i = offset; i < end; i++) {
            int value = window[i] & 0xFF;
            if (!seen[value]) {
                seen[value] = true;
                distinct++;
            }
        }

        return distinct;
    }

    @Override
    public String getName() {
        return "Distinct bytes";
    }
}
