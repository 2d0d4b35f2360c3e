package com.densityviz.io;

import java.io.IOException;

/**
 * A single seek or read failed, e.g. because another process truncated the
 * file. Recovered by skipping the sample.
 */
public class SampleReadException extends IOException {

    private final long position;

    public SampleReadException(long position, Throwable cause) {
        super("Sample read failed at position " + position, cause);
        this.position = position;
    }

    public long getPosition() {
        return position;
    }
}
