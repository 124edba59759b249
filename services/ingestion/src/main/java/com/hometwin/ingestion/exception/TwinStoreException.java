package com.hometwin.ingestion.exception;

/**
 * The twin store rejected a request in a way the processor does not compensate for.
 * A status of 0 means the request never got an HTTP response.
 */
public class TwinStoreException extends IngestionException {

    private final String twinId;
    private final int status;

    public TwinStoreException(String twinId, String operation, int status, String detail) {
        super(String.format("Twin store %s of '%s' failed (status %d): %s", operation, twinId, status, detail));
        this.twinId = twinId;
        this.status = status;
    }

    public String getTwinId() {
        return twinId;
    }

    public int getStatus() {
        return status;
    }
}
