package io.csvchange.monitor;

import java.nio.file.Path;

/**
 * A watch could not be established: the parent directory is unreachable or not readable.
 */
public class WatchException extends RuntimeException {
    private final Path path;

    public WatchException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public WatchException(Path path, String message) {
        this(path, message, null);
    }

    public Path path() { return path; }
}
