package com.hometwin.ingestion.service;

import com.hometwin.common.dto.twin.TwinDocument;
import com.hometwin.common.dto.twin.TwinPatch;

/**
 * The two twin store operations the processor needs. Implementations report the outcome as a
 * {@link TwinStoreResponse} instead of throwing, so the caller can decide how to compensate.
 */
public interface TwinStore {

    /**
     * Applies a JSON Patch to an existing twin.
     */
    TwinStoreResponse updateTwin(String twinId, TwinPatch patch);

    /**
     * Creates the twin, or replaces it if it already exists.
     */
    TwinStoreResponse createOrReplaceTwin(String twinId, TwinDocument document);
}
