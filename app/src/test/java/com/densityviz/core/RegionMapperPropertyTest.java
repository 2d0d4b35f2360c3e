package com.densityviz.core;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

/**
 * Property-based tests for region mapping using jqwik.
 */
class RegionMapperPropertyTest {

    @Property
    void sampleWindowStaysInsideFile(@ForAll @IntRange(min = 1, max = 64) int width,
                                     @ForAll @IntRange(min = 1, max = 64) int height,
                                     @ForAll @IntRange(min = 1, max = 32) int sampleBytes,
                                     @ForAll @LongRange(min = 0, max = 5_000_000) long extraBytes,
                                     @ForAll long seed) {
        GridGeometry geometry = new GridGeometry(width, height);
        long fileSize = RegionMapper.minimumFileSize(geometry, sampleBytes) + extraBytes;
        RegionMapper mapper = new RegionMapper(fileSize, geometry, sampleBytes);
        Random random = new Random(seed);

        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                long position = mapper.samplePosition(x, y, random);
                assertTrue(position >= 0, "Negative position " + position);
                assertTrue(position + sampleBytes <= fileSize,
                    "Window at " + position + " overruns file of " + fileSize);
            }
        }
    }

    @Property
    void regionStartsIncreaseWithIndex(@ForAll @IntRange(min = 1, max = 50) int width,
                                       @ForAll @IntRange(min = 1, max = 50) int height,
                                       @ForAll @LongRange(min = 0, max = 10_000_000) long fileSize) {
        GridGeometry geometry = new GridGeometry(width, height);
        RegionMapper mapper = new RegionMapper(fileSize, geometry, 1);

        long previous = -1;
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                long start = mapper.regionStart(x, y);
                assertTrue(start >= previous);
                previous = start;
            }
        }
    }
}
