package com.phillippitts.streamwatch.exception;

import java.nio.file.Path;

/**
 * Thrown when channel records cannot be read from or written to the backing store.
 * In-memory state stays authoritative; the next debounced save retries.
 */
public class PersistenceException extends StreamWatchException {

    private final Path path;

    public PersistenceException(Path path, String message, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
