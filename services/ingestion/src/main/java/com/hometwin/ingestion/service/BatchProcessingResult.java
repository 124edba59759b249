package com.hometwin.ingestion.service;

import com.hometwin.common.dto.event.BatchProcessingResponse;
import com.hometwin.ingestion.exception.BatchProcessingException;
import com.hometwin.ingestion.exception.EventProcessingException;

import java.util.List;

/**
 * Per-event outcomes of a processed batch, in input order.
 */
public record BatchProcessingResult(List<EventOutcome> outcomes) {

    public BatchProcessingResult {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public long count(EventStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public long written() {
        return outcomes.stream().filter(o -> o.status().isWrite()).count();
    }

    public List<EventOutcome> failures() {
        return outcomes.stream().filter(EventOutcome::isFailure).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(EventOutcome::isFailure);
    }

    /**
     * Signals the batch's failures to a caller that works with exceptions: nothing when every
     * event succeeded or was skipped, the event's own exception when exactly one failed, and a
     * {@link BatchProcessingException} holding all of them otherwise.
     */
    public void throwIfFailed() {
        List<EventOutcome> failures = failures();
        if (failures.isEmpty()) {
            return;
        }
        if (failures.size() == 1) {
            EventOutcome failure = failures.get(0);
            if (failure.error() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new EventProcessingException(failure.index(), failure.error());
        }
        throw new BatchProcessingException(total(), failures.stream().map(EventOutcome::error).toList());
    }

    public BatchProcessingResponse toResponse() {
        List<BatchProcessingResponse.EventError> errors = failures().stream()
                .map(f -> new BatchProcessingResponse.EventError(f.index(), f.twinId(), f.detail()))
                .toList();
        return BatchProcessingResponse.of(
                total(),
                (int) written(),
                (int) count(EventStatus.SKIPPED),
                errors
        );
    }

    @Override
    public String toString() {
        return String.format("total=%d, applied=%d, created=%d, initialized=%d, skipped=%d, failed=%d",
                total(),
                count(EventStatus.APPLIED),
                count(EventStatus.CREATED),
                count(EventStatus.INITIALIZED),
                count(EventStatus.SKIPPED),
                count(EventStatus.FAILED));
    }
}
