package com.hometwin.ingestion.service;

/**
 * Outcome of a twin store call.
 */
public sealed interface TwinStoreResponse {

    Applied APPLIED = new Applied();
    NotFound NOT_FOUND = new NotFound();
    FieldNotInitialized FIELD_NOT_INITIALIZED = new FieldNotInitialized();

    /** The request was accepted. */
    record Applied() implements TwinStoreResponse {}

    /** No twin with the given id exists. */
    record NotFound() implements TwinStoreResponse {}

    /** The patch targets a property path the twin does not have yet. */
    record FieldNotInitialized() implements TwinStoreResponse {}

    /**
     * Any other rejection or transport failure; {@code status} is 0 when no response was received.
     */
    record OtherError(int status, String detail) implements TwinStoreResponse {}
}
