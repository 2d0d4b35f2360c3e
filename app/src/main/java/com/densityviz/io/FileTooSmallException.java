package com.densityviz.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file holds fewer bytes than one sample window per grid cell.
 */
public class FileTooSmallException extends IOException {

    private final Path path;
    private final long actualSize;
    private final long requiredSize;

    public FileTooSmallException(Path path, long actualSize, long requiredSize) {
        super(String.format("File too small to map: %s (%d bytes, need at least %d)",
            path, actualSize, requiredSize));
        this.path = path;
        this.actualSize = actualSize;
        this.requiredSize = requiredSize;
    }

    public Path getPath() {
        return path;
    }

    public long getActualSize() {
        return actualSize;
    }

    public long getRequiredSize() {
        return requiredSize;
    }
}
