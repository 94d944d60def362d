package com.phillippitts.streamwatch.exception;

/**
 * Base exception for all stream-watch application-specific errors.
 * All domain exceptions extend this class so the REST boundary can map them centrally.
 */
public class StreamWatchException extends RuntimeException {

    public StreamWatchException(String message) {
        super(message);
    }

    public StreamWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamWatchException(Throwable cause) {
        super(cause);
    }
}
