package com.hometwin.ingestion.exception;

import java.util.List;

/**
 * Raised at the end of a batch in which more than one event failed. Carries every failure,
 * in batch order; they are also attached as suppressed exceptions so that they show up in
 * logged stack traces.
 */
public class BatchProcessingException extends IngestionException {

    private final List<Throwable> errors;

    public BatchProcessingException(int total, List<Throwable> errors) {
        super(errors.size() + " of " + total + " events failed");
        this.errors = List.copyOf(errors);
        this.errors.forEach(this::addSuppressed);
    }

    public List<Throwable> getErrors() {
        return errors;
    }
}
