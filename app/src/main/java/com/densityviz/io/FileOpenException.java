package com.densityviz.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file could not be opened for sampling: it does not exist, is not a
 * regular file, or is not readable.
 */
public class FileOpenException extends IOException {

    private final Path path;

    public FileOpenException(Path path, String reason) {
        super(reason + ": " + path);
        this.path = path;
    }

    public FileOpenException(Path path, String reason, Throwable cause) {
        super(reason + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
