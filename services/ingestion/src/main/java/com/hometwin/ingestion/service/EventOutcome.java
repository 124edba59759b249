package com.hometwin.ingestion.service;

/**
 * Result for one event, by its position in the batch. {@code twinId} is {@code null} when the
 * event did not get as far as resolving its entity id.
 */
public record EventOutcome(
    int index,
    String twinId,
    EventStatus status,
    String detail,
    Throwable error
) {
    public static EventOutcome written(int index, String twinId, EventStatus status) {
        return new EventOutcome(index, twinId, status, null, null);
    }

    public static EventOutcome skipped(int index, String twinId, String reason) {
        return new EventOutcome(index, twinId, EventStatus.SKIPPED, reason, null);
    }

    public static EventOutcome failed(int index, String twinId, Throwable error) {
        return new EventOutcome(index, twinId, EventStatus.FAILED, error.getMessage(), error);
    }

    public boolean isFailure() {
        return status == EventStatus.FAILED;
    }
}
