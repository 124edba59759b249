package com.hometwin.ingestion.exception;

/**
 * Payload could not be parsed, or one of its fields is not in the expected format.
 */
public class MalformedEventException extends IngestionException {

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
