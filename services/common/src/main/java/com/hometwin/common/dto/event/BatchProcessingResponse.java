package com.hometwin.common.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response for a processed event batch.
 */
public record BatchProcessingResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("total")
    int total,

    @JsonProperty("applied")
    int applied,

    @JsonProperty("skipped")
    int skipped,

    @JsonProperty("failed")
    int failed,

    @JsonProperty("processedAt")
    Instant processedAt,

    @JsonProperty("errors")
    List<EventError> errors
) {
    public record EventError(
        @JsonProperty("index")
        int index,

        @JsonProperty("twinId")
        String twinId,

        @JsonProperty("message")
        String message
    ) {}

    public static BatchProcessingResponse of(int total, int applied, int skipped, List<EventError> errors) {
        String status;
        if (errors.isEmpty()) {
            status = "OK";
        } else if (errors.size() < total) {
            status = "PARTIAL";
        } else {
            status = "ERROR";
        }
        return new BatchProcessingResponse(
            status,
            total,
            applied,
            skipped,
            errors.size(),
            Instant.now(),
            List.copyOf(errors)
        );
    }
}
