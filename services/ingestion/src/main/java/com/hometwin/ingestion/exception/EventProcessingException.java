package com.hometwin.ingestion.exception;

/**
 * Wraps a checked exception recorded for a single event so it can be rethrown.
 */
public class EventProcessingException extends IngestionException {

    private final int index;

    public EventProcessingException(int index, Throwable cause) {
        super("Event " + index + " failed: " + cause.getMessage(), cause);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
