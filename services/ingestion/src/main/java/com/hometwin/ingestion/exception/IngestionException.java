package com.hometwin.ingestion.exception;

/**
 * Base class for errors raised while applying a sensor state event to its twin.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
