package com.densityviz.service;

import com.densityviz.core.GridCell;

/**
 * Details of one grid cell: where its region starts, what has been committed
 * for it so far and a freshly read sample window.
 */
public class CellInspection {

    private final int x;
    private final int y;
    private final long regionStart;
    private final long samplePosition;
    private final GridCell cell;
    private final byte[] sample;

    public CellInspection(int x, int y, long regionStart, long samplePosition, GridCell cell, byte[] sample) {
        this.x = x;
        this.y = y;
        this.regionStart = regionStart;
        this.samplePosition = samplePosition;
        this.cell = cell;
        this.sample = sample;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public long getRegionStart() {
        return regionStart;
    }

    public long getSamplePosition() {
        return samplePosition;
    }

    /**
     * Committed cell, or null if the cell has not been sampled yet.
     */
    public GridCell getCell() {
        return cell;
    }

    public long getCount() {
        return cell != null ? cell.getCount() : 0;
    }

    /**
     * Bytes read at {@link #getSamplePosition()}; shorter than the sample
     * width if the read hit end of file.
     */
    public byte[] getSample() {
        return sample.clone();
    }

    public String getSampleHex() {
        StringBuilder sb = new StringBuilder(sample.length * 2);
        for (byte b : sample) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        String average = cell != null ? String.format("%.2f", cell.getAverage()) : "N/A";
        return String.format("(%d, %d) region %d, %d samples, average %s, sample %s",
            x, y, regionStart, getCount(), average, getSampleHex());
    }
}
