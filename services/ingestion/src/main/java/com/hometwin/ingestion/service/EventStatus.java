package com.hometwin.ingestion.service;

/**
 * What happened to a single event of a batch.
 */
public enum EventStatus {
    APPLIED,        // existing twin updated
    CREATED,        // twin did not exist and was created
    INITIALIZED,    // twin existed without lastKnownValue, which was added
    SKIPPED,        // nothing to do (no or unknown device class, unmappable state, missing fields)
    FAILED;

    /**
     * True for the statuses that wrote to the twin store.
     */
    public boolean isWrite() {
        return this == APPLIED || this == CREATED || this == INITIALIZED;
    }
}
