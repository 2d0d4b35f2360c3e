package com.densityviz.service;

import com.densityviz.core.RegionMapper;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.SampleReadException;
import com.densityviz.io.SharedFileReader;

import java.util.Random;

/**
 * Reads and scores one sample window for a grid cell. Holds a reusable
 * buffer, so each worker owns its own instance.
 */
public class RegionSampler {

    /** Returned when the read came back empty. */
    public static final int NO_SAMPLE = 0;

    private final RegionMapper mapper;
    private final ScoreFunction scoreFunction;
    private final byte[] buffer;

    public RegionSampler(RegionMapper mapper, ScoreFunction scoreFunction) {
        this.mapper = mapper;
        this.scoreFunction = scoreFunction;
        this.buffer = new byte[mapper.getSampleBytes()];
    }

    public RegionMapper getMapper() {
        return mapper;
    }

    /**
     * Sample a cell at a random offset inside its region.
     *
     * @return The score, or {@link #NO_SAMPLE} if nothing could be read
     */
    public int sample(SharedFileReader reader, int x, int y, Random random) throws SampleReadException {
        long position = mapper.samplePosition(x, y, random);
        int read = reader.readAt(position, buffer, buffer.length);
        if (read <= 0) {
            return NO_SAMPLE;
        }
        return scoreFunction.score(buffer, 0, read);
    }
}
