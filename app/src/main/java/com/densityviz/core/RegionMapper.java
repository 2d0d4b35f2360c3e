package com.densityviz.core;

import java.util.Random;

/**
 * Maps grid coordinates onto byte regions of a file.
 *
 * The file is split into {@code totalPoints} equal regions of
 * {@code fileSize / totalPoints} bytes (not necessarily integral). A sample
 * for a cell starts at a random offset inside its region, leaving room for
 * the whole sample window. When a region is narrower than the window the
 * offset is pinned to the region start.
 */
public final class RegionMapper {

    private final long fileSize;
    private final GridGeometry geometry;
    private final int sampleBytes;
    private final double chunkSize;
    private final long maxOffset;

    public RegionMapper(long fileSize, GridGeometry geometry, int sampleBytes) {
        if (fileSize < 0) {
            throw new IllegalArgumentException("Negative file size: " + fileSize);
        }
        if (sampleBytes <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleBytes);
        }
        this.fileSize = fileSize;
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.chunkSize = (double) fileSize / geometry.getTotalPoints();
        this.maxOffset = (long) Math.max(0.0, chunkSize - sampleBytes);
    }

    /**
     * Smallest file that can be mapped without overlapping sample windows.
     */
    public static long minimumFileSize(GridGeometry geometry, int sampleBytes) {
        return (long) geometry.getTotalPoints() * sampleBytes;
    }

    public static boolean canMap(long fileSize, GridGeometry geometry, int sampleBytes) {
        return fileSize >= minimumFileSize(geometry, sampleBytes);
    }

    public long getFileSize() {
        return fileSize;
    }

    public GridGeometry getGeometry() {
        return geometry;
    }

    public int getSampleBytes() {
        return sampleBytes;
    }

    public double getChunkSize() {
        return chunkSize;
    }

    /**
     * Largest random offset added to a region start; 0 means sampling is
     * deterministic.
     */
    public long getMaxOffset() {
        return maxOffset;
    }

    public long regionStart(int x, int y) {
        return (long) Math.floor(geometry.indexOf(x, y) * chunkSize);
    }

    /**
     * Byte position for a region start plus an explicit offset, clamped to
     * {@link #getMaxOffset()}.
     */
    public long positionAt(int x, int y, long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset: " + offset);
        }
        return regionStart(x, y) + Math.min(offset, maxOffset);
    }

    public long samplePosition(int x, int y, Random random) {
        long offset = maxOffset == 0 ? 0 : random.nextLong(maxOffset + 1);
        return regionStart(x, y) + offset;
    }
}
